package fun.fengwk.lds.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds and installs the navigator patch script for a browser context.
 *
 * <p>Patches are picked per engine so the script never introduces objects
 * the configured engine would not expose, e.g. {@code window.chrome} on firefox.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    private static final String HIDE_WEBDRIVER =
        "Object.defineProperty(Navigator.prototype, 'webdriver', { get: () => false });";

    private static final String CHROME_RUNTIME =
        "window.chrome = window.chrome || { runtime: {} };";

    private static final String CHROME_PERMISSIONS = """
        const originalQuery = navigator.permissions && navigator.permissions.query;
        if (originalQuery) {
          navigator.permissions.query = (parameters) => (
            parameters && parameters.name === 'notifications'
              ? Promise.resolve({ state: Notification.permission })
              : originalQuery.call(navigator.permissions, parameters)
          );
        }""";

    private BrowserStealthSupport() {
    }

    public static void apply(BrowserContext context, BrowserProperties properties) {
        String script = properties.resolveStealthScript();
        if (!StringUtils.hasText(script)) {
            return;
        }
        context.addInitScript(script);
    }

    /**
     * Default patch script for the configured engine and languages.
     */
    public static String defaultScript(BrowserProperties properties) {
        List<String> patches = new ArrayList<>();
        patches.add(HIDE_WEBDRIVER);
        List<String> languages = languages(properties.getAcceptLanguage());
        if (!languages.isEmpty()) {
            patches.add("Object.defineProperty(Navigator.prototype, 'languages', { get: () => "
                + toJsArray(languages) + " });");
        }
        if (isChromium(properties.getBrowserType())) {
            patches.add(CHROME_RUNTIME);
            patches.add(CHROME_PERMISSIONS);
        }

        StringBuilder script = new StringBuilder("(() => {\n");
        for (String patch : patches) {
            script.append("  try {\n");
            for (String line : patch.split("\n")) {
                script.append("    ").append(line).append('\n');
            }
            script.append("  } catch (e) {}\n");
        }
        return script.append("})();\n").toString();
    }

    /**
     * Language tags of an Accept-Language value in preference order, weights dropped.
     */
    static List<String> languages(String acceptLanguage) {
        if (!StringUtils.hasText(acceptLanguage)) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String part : acceptLanguage.split(",")) {
            String tag = part.split(";")[0].trim();
            if (!tag.isEmpty() && !"*".equals(tag)) {
                tags.add(tag);
            }
        }
        return List.copyOf(tags);
    }

    private static boolean isChromium(String browserType) {
        if (!StringUtils.hasText(browserType)) {
            return true;
        }
        String type = browserType.toLowerCase(Locale.ROOT);
        return !"firefox".equals(type) && !"webkit".equals(type);
    }

    private static String toJsArray(List<String> values) {
        StringBuilder array = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                array.append(", ");
            }
            array.append('\'').append(values.get(i).replace("\\", "\\\\").replace("'", "\\'")).append('\'');
        }
        return array.append(']').toString();
    }

}
