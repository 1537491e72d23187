package fun.fengwk.lds.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * File-backed run storage.
 *
 * <p>Layout under the root directory:
 * <ul>
 *     <li>{@code datasets/default/data.jsonl}, one JSON document per line.</li>
 *     <li>{@code key_value_stores/default/{key}.json}, replaced atomically on each write.</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class FileRunStorage implements RunStorage {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final ObjectMapper objectMapper;
    private final Path datasetPath;
    private final Path keyValueDir;
    private final Object datasetLock = new Object();

    public FileRunStorage(ObjectMapper objectMapper, StorageProperties storageProperties) {
        this.objectMapper = objectMapper;
        Path root = Paths.get(storageProperties.getRootDir()).toAbsolutePath().normalize();
        this.datasetPath = root.resolve("datasets").resolve("default").resolve("data.jsonl");
        this.keyValueDir = root.resolve("key_value_stores").resolve("default");
    }

    @Override
    public void pushData(List<?> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        synchronized (datasetLock) {
            try {
                Files.createDirectories(datasetPath.getParent());
                try (BufferedWriter writer = Files.newBufferedWriter(
                    datasetPath,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    for (Object item : items) {
                        writer.write(objectMapper.writeValueAsString(item));
                        writer.newLine();
                    }
                }
            } catch (Exception ex) {
                throw new IllegalStateException("failed to push data: " + ex.getMessage(), ex);
            }
        }
        log.debug("pushed items to dataset, count={}, path={}", items.size(), datasetPath);
    }

    @Override
    public void setValue(String key, Object value) {
        if (!StringUtils.hasText(key) || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("invalid key: " + key);
        }
        Path target = keyValueDir.resolve(key + ".json");
        try {
            writeAtomically(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (Exception ex) {
            throw new IllegalStateException("failed to set value, key=" + key + ": " + ex.getMessage(), ex);
        }
        log.debug("stored value, key={}, path={}", key, target);
    }

    public Path getDatasetPath() {
        return datasetPath;
    }

    public Path resolveValuePath(String key) {
        return keyValueDir.resolve(key + ".json");
    }

    private void writeAtomically(Path targetPath, String content) throws Exception {
        Files.createDirectories(targetPath.getParent());
        Path tmpPath = targetPath.getParent().resolve(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmpPath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try {
            Files.move(tmpPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (Exception ex) {
            Files.move(tmpPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

}
