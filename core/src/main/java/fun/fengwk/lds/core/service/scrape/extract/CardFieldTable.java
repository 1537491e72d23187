package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declarative field table for listing cards.
 *
 * <p>Each field owns an ordered list of matchers. A matcher pairs a css selector with an
 * extractor; the first matcher whose selector matches and whose extractor writes a value wins.
 *
 * @author fengwk
 */
final class CardFieldTable {

    private static final Pattern DECIMAL = Pattern.compile("(\\d+\\.?\\d*)");
    private static final Pattern INTEGER = Pattern.compile("(\\d+)");

    private static final int MIN_BIO_LENGTH = 50;

    private CardFieldTable() {
    }

    static List<FieldRule> rules(String baseUrl) {
        List<FieldRule> rules = new ArrayList<>();
        rules.add(rule("name", nameAndLink(baseUrl),
            "[data-testid=\"lawyer-name\"]", "h2 a", "h3 a", ".lawyer-name", ".profile-name", "a[href*=\"/attorney/\"]"));
        rules.add(rule("rating", firstNumber("rating", DECIMAL),
            "[data-testid=\"rating\"]", ".rating-value", ".avvo-rating", "[class*=\"rating\"]"));
        rules.add(rule("reviewCount", firstNumber("reviewCount", INTEGER),
            "[data-testid=\"review-count\"]", ".review-count", "[class*=\"review\"]"));

        String[] practiceSelectors = {
            "[data-testid=\"practice-areas\"]", ".practice-areas", ".specialties", "[class*=\"practice\"]"
        };
        List<FieldMatcher> practiceMatchers = new ArrayList<>();
        for (String selector : practiceSelectors) {
            practiceMatchers.add(new FieldMatcher(selector, items("practiceAreas", "li, span, a", 2)));
        }
        for (String selector : practiceSelectors) {
            practiceMatchers.add(new FieldMatcher(selector, commaSplit("practiceAreas", 2)));
        }
        rules.add(new FieldRule("practiceAreas", practiceMatchers));

        rules.add(rule("location", text("location"),
            "[data-testid=\"location\"]", ".location", ".address", "[class*=\"location\"]"));
        rules.add(rule("phone", phone(),
            "[data-testid=\"phone\"]", ".phone", "a[href^=\"tel:\"]", "[class*=\"phone\"]"));
        rules.add(rule("website", href("website"),
            "[data-testid=\"website\"]", "a[href*=\"website\"]", ".website", "a[data-website]"));
        rules.add(rule("yearsLicensed", firstNumber("yearsLicensed", INTEGER),
            "[data-testid=\"years-licensed\"]", ".years-licensed", "[class*=\"years\"]"));
        rules.add(rule("barAdmissions", items("barAdmissions", "li, span", 1),
            "[data-testid=\"bar-admissions\"]", ".bar-admissions", "[class*=\"bar\"]"));
        rules.add(rule("languages", items("languages", "li, span", 1),
            "[data-testid=\"languages\"]", ".languages", "[class*=\"language\"]"));
        rules.add(rule("bio", longText("bio", MIN_BIO_LENGTH),
            "[data-testid=\"bio\"]", ".bio", ".description", ".profile-description", "p"));
        return rules;
    }

    /**
     * Run every rule against one card.
     */
    static void apply(List<FieldRule> rules, Element card, ObjectNode target) {
        for (FieldRule rule : rules) {
            for (FieldMatcher matcher : rule.matchers()) {
                Elements matches = findWithin(card, matcher.selector());
                if (!matches.isEmpty() && matcher.extractor().extract(matches, target)) {
                    break;
                }
            }
        }
    }

    // Descendants only, the root never matches its own selector.
    private static Elements findWithin(Element root, String selector) {
        Elements found = new Elements();
        for (Element element : root.select(selector)) {
            if (element != root) {
                found.add(element);
            }
        }
        return found;
    }

    private static FieldRule rule(String field, FieldExtractor extractor, String... selectors) {
        List<FieldMatcher> matchers = new ArrayList<>(selectors.length);
        for (String selector : selectors) {
            matchers.add(new FieldMatcher(selector, extractor));
        }
        return new FieldRule(field, matchers);
    }

    private static FieldExtractor nameAndLink(String baseUrl) {
        return (matches, target) -> {
            Element element = matches.first();
            String name = element.text().trim();
            if (name.isEmpty()) {
                return false;
            }
            target.put("name", name);
            target.put("profileUrl", absolutize(baseUrl, element.attr("href")));
            return true;
        };
    }

    private static FieldExtractor firstNumber(String field, Pattern pattern) {
        return (matches, target) -> {
            Matcher matcher = pattern.matcher(matches.first().text());
            if (!matcher.find()) {
                return false;
            }
            try {
                if (pattern == DECIMAL) {
                    target.put(field, Double.parseDouble(matcher.group(1)));
                } else {
                    target.put(field, Integer.parseInt(matcher.group(1)));
                }
            } catch (NumberFormatException ex) {
                // Out of range, only this field is dropped.
                return false;
            }
            return true;
        };
    }

    private static FieldExtractor items(String field, String itemSelector, int minExclusiveLength) {
        return (matches, target) -> {
            List<String> values = new ArrayList<>();
            for (Element container : matches) {
                for (Element item : findWithin(container, itemSelector)) {
                    String value = item.text().trim();
                    if (value.length() > minExclusiveLength) {
                        values.add(value);
                    }
                }
            }
            if (values.isEmpty()) {
                return false;
            }
            putList(target, field, values);
            return true;
        };
    }

    private static FieldExtractor commaSplit(String field, int minExclusiveLength) {
        return (matches, target) -> {
            String text = matches.first().text().trim();
            if (!text.contains(",")) {
                return false;
            }
            List<String> values = new ArrayList<>();
            for (String token : text.split(",")) {
                String value = token.trim();
                if (value.length() > minExclusiveLength) {
                    values.add(value);
                }
            }
            putList(target, field, values);
            return true;
        };
    }

    private static FieldExtractor text(String field) {
        return (matches, target) -> {
            String value = matches.first().text().trim();
            if (value.isEmpty()) {
                return false;
            }
            target.put(field, value);
            return true;
        };
    }

    private static FieldExtractor phone() {
        return (matches, target) -> {
            Element element = matches.first();
            String value = element.text().trim();
            if (value.isEmpty()) {
                value = element.attr("href").replace("tel:", "").trim();
            }
            if (value.isEmpty()) {
                return false;
            }
            target.put("phone", value);
            return true;
        };
    }

    private static FieldExtractor href(String field) {
        return (matches, target) -> {
            String value = matches.first().attr("href").trim();
            if (value.isEmpty()) {
                return false;
            }
            target.put(field, value);
            return true;
        };
    }

    private static FieldExtractor longText(String field, int minExclusiveLength) {
        return (matches, target) -> {
            String value = matches.first().text().trim();
            if (value.length() <= minExclusiveLength) {
                return false;
            }
            target.put(field, value);
            return true;
        };
    }

    private static void putList(ObjectNode target, String field, List<String> values) {
        ArrayNode array = target.putArray(field);
        values.forEach(array::add);
    }

    static String absolutize(String baseUrl, String href) {
        if (!StringUtils.hasText(href)) {
            return "";
        }
        String link = href.trim();
        if (link.startsWith("http")) {
            return link;
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return link.startsWith("/") ? base + link : base + "/" + link;
    }

    @FunctionalInterface
    interface FieldExtractor {

        /**
         * Write the field into {@code target} from non-empty {@code matches}.
         *
         * @return true when a value was written
         */
        boolean extract(Elements matches, ObjectNode target);

    }

    record FieldMatcher(String selector, FieldExtractor extractor) {
    }

    record FieldRule(String field, List<FieldMatcher> matchers) {
    }

}
