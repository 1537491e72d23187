package fun.fengwk.lds.core.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Run storage configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lds.storage")
public class StorageProperties {

    /**
     * Root directory holding the dataset and the key-value store.
     */
    private String rootDir = "./storage";

}
