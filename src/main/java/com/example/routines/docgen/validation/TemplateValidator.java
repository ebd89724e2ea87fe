package com.example.routines.docgen.validation;

import com.example.routines.docgen.aspect.LogExecutionTime;
import com.example.routines.docgen.layout.PageFormat;
import com.example.routines.docgen.model.QrPosition;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.qr.QrPayloadResolver;
import com.example.routines.docgen.renderer.ExerciseTableSectionRenderer;
import com.example.routines.docgen.util.ContentHashing;
import com.example.routines.docgen.util.UnitConverter;
import com.example.routines.docgen.util.Values;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Structural and heuristic checks of a template definition.
 *
 * Only a missing top-level key or a non-list {@code pages} is an error; every
 * content-shape problem is a warning so callers can still render best effort.
 * Never throws.
 */
@Slf4j
@Component
public class TemplateValidator {
    static final List<String> REQUIRED_KEYS = Arrays.asList("metadata", "layout", "pages", "variables");
    static final List<String> VARIABLE_TYPES = Arrays.asList("string", "number", "boolean", "date", "image");
    static final List<String> ORIENTATIONS = Arrays.asList("portrait", "landscape");
    static final List<String> QR_SOURCES = Arrays.asList(
            QrPayloadResolver.ROUTINE_UUID, QrPayloadResolver.USER_DATA, QrPayloadResolver.CUSTOM_URL);
    static final List<String> MARGIN_SIDES = Arrays.asList("top", "bottom", "left", "right");

    static final int MAX_PAGES = 10;
    static final int MAX_SECTIONS = 50;
    static final int MAX_VARIABLES = 100;
    static final String UNSAFE_MARKER = "javascript:";

    /** Collects issues during one validation run. */
    private static final class Issues {
        final List<ValidationIssue> errors = new ArrayList<>();
        final List<ValidationIssue> warnings = new ArrayList<>();
        final List<ValidationIssue> info = new ArrayList<>();

        void error(String path, String message) {
            errors.add(new ValidationIssue(ValidationSeverity.ERROR, message, path, null));
        }

        void warning(String path, String message) {
            warning(path, message, null);
        }

        void warning(String path, String message, String suggestion) {
            warnings.add(new ValidationIssue(ValidationSeverity.WARNING, message, path, suggestion));
        }

        void info(String path, String message) {
            info.add(new ValidationIssue(ValidationSeverity.INFO, message, path, null));
        }

        ValidationResult toResult(double performance, double security) {
            return ValidationResult.builder()
                    .errors(errors)
                    .warnings(warnings)
                    .info(info)
                    .performanceScore(performance)
                    .securityScore(security)
                    .build();
        }
    }

    @LogExecutionTime("Template Validation")
    public ValidationResult validate(Map<String, Object> config) {
        Issues issues = new Issues();
        if (config == null) {
            REQUIRED_KEYS.forEach(key -> issues.error(key, "Missing required field: " + key));
            return issues.toResult(100, 100);
        }
        for (String key : REQUIRED_KEYS) {
            if (!config.containsKey(key)) {
                issues.error(key, "Missing required field: " + key);
            }
        }
        Object pages = config.get("pages");
        if (!(pages instanceof List)) {
            if (config.containsKey("pages")) {
                issues.error("pages", "Field 'pages' must be a list");
            }
            return issues.toResult(100, 100);
        }

        checkMetadata(config.get("metadata"), issues);
        checkLayout(config.get("layout"), issues);
        int exerciseTables = checkPages((List<?>) pages, issues);
        checkVariables(config.get("variables"), issues);
        checkQrCode(config.get("qr_code"), issues);
        if (exerciseTables == 0) {
            issues.info("pages", "Template has no exercise_table section; routine days will not be listed");
        }

        double performance = assessPerformance(config, issues);
        double security = assessSecurity(config, issues);
        ValidationResult result = issues.toResult(performance, security);
        log.debug("Validated template: {} errors, {} warnings", result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    private void checkMetadata(Object raw, Issues issues) {
        if (raw == null) {
            return;
        }
        if (!(raw instanceof Map)) {
            issues.warning("metadata", "Field 'metadata' should be an object");
            return;
        }
        Map<String, Object> metadata = Values.asMap(raw);
        if (Values.isBlank(metadata.get("name"))) {
            issues.warning("metadata.name", "Template has no name");
        }
        if (Values.isBlank(metadata.get("description"))) {
            issues.warning("metadata.description", "Template has no description");
        }
    }

    private void checkLayout(Object raw, Issues issues) {
        if (raw == null) {
            return;
        }
        if (!(raw instanceof Map)) {
            issues.warning("layout", "Field 'layout' should be an object");
            return;
        }
        Map<String, Object> layout = Values.asMap(raw);
        Object pageSize = layout.get("page_size");
        if (pageSize != null && !PageFormat.isKnown(Values.asString(pageSize))) {
            issues.warning("layout.page_size", "Unknown page size '" + Values.asString(pageSize) + "', A4 will be used",
                    didYouMean(Values.asString(pageSize), PageFormat.displayNames()));
        }
        Object orientation = layout.get("orientation");
        if (orientation != null) {
            String value = Values.asString(orientation).trim().toLowerCase(Locale.ROOT);
            if (!ORIENTATIONS.contains(value)) {
                issues.warning("layout.orientation", "Unknown orientation '" + Values.asString(orientation) + "'",
                        didYouMean(value, ORIENTATIONS));
            } else if ("landscape".equals(value)) {
                issues.info("layout.orientation", "Landscape orientation: page width and height are swapped");
            }
        }
        Object margins = layout.get("margins");
        if (margins != null && !(margins instanceof Map)) {
            issues.warning("layout.margins", "Field 'margins' should be an object");
            return;
        }
        Map<String, Object> marginMap = Values.asMap(margins);
        for (String side : MARGIN_SIDES) {
            if (!marginMap.containsKey(side)) {
                continue;
            }
            OptionalDouble points = UnitConverter.parse(marginMap.get(side));
            if (!points.isPresent()) {
                issues.warning("layout.margins." + side, "Margin '" + side + "' is not a valid length");
            } else if (points.getAsDouble() < 0) {
                issues.warning("layout.margins." + side, "Margin '" + side + "' is negative");
            }
        }
    }

    /**
     * @return number of exercise tables found
     */
    private int checkPages(List<?> pages, Issues issues) {
        int exerciseTables = 0;
        for (int p = 0; p < pages.size(); p++) {
            String pagePath = "pages[" + p + "]";
            if (!(pages.get(p) instanceof Map)) {
                issues.warning(pagePath, "Page " + (p + 1) + " is not an object");
                continue;
            }
            Object sections = Values.asMap(pages.get(p)).get("sections");
            if (sections != null && !(sections instanceof List)) {
                issues.warning(pagePath + ".sections", "Field 'sections' should be a list");
                continue;
            }
            List<?> sectionList = Values.asList(sections);
            if (sectionList.isEmpty()) {
                issues.warning(pagePath + ".sections", "Page " + (p + 1) + " has no sections");
            }
            for (int s = 0; s < sectionList.size(); s++) {
                String path = pagePath + ".sections[" + s + "]";
                if (!(sectionList.get(s) instanceof Map)) {
                    issues.warning(path, "Section is not an object");
                    continue;
                }
                if (checkSection(Values.asMap(sectionList.get(s)), path, issues) == SectionType.EXERCISE_TABLE) {
                    exerciseTables++;
                }
            }
        }
        return exerciseTables;
    }

    private SectionType checkSection(Map<String, Object> section, String path, Issues issues) {
        Object rawType = section.get("type");
        if (Values.isBlank(rawType)) {
            issues.warning(path + ".type", "Section has no type");
            return SectionType.UNKNOWN;
        }
        SectionType type = SectionType.fromValue(rawType);
        if (type == SectionType.UNKNOWN) {
            String value = Values.asString(rawType);
            issues.warning(path + ".type", "Unknown section type '" + value + "'",
                    didYouMean(value, SectionType.knownNames()));
            return type;
        }

        // settings resolve like Section.get: content first, then the section itself
        Section settings = Section.from(section);
        Object rawContent = settings.getContent();
        switch (type) {
            case HEADER:
                if (Values.isBlank(settings.get("title")) && Values.isBlank(settings.get("subtitle"))) {
                    issues.warning(path + ".content", "Header needs a title or a subtitle");
                }
                break;
            case TEXT:
                Object text = rawContent instanceof Map ? settings.get("text")
                        : rawContent != null ? rawContent : section.get("text");
                if (Values.isBlank(text)) {
                    issues.warning(path + ".content", "Text section has no text");
                }
                break;
            case TABLE:
                if (Values.asList(settings.get("rows")).isEmpty()) {
                    issues.warning(path + ".content.rows", "Table needs at least one row");
                }
                break;
            case IMAGE:
                Object src = settings.get("src", settings.get("path"));
                if (Values.isBlank(src)) {
                    issues.warning(path + ".content.src", "Image needs a non-empty src");
                } else if (!Values.asString(src).contains("{{") && !Values.asString(src).startsWith("data:image/")) {
                    issues.warning(path + ".content.src", "Only data:image URIs are rendered; this image will be skipped");
                }
                break;
            case EXERCISE_TABLE:
                checkExerciseTable(settings, path, issues);
                break;
            case QR_CODE:
                Map<String, Object> qrSettings = new LinkedHashMap<>(section);
                qrSettings.putAll(settings.contentMap());
                checkQrSource(qrSettings, path + ".content", issues);
                break;
            case SPACING:
                Object height = settings.get("height");
                if (height != null && !UnitConverter.parse(height).isPresent()) {
                    issues.warning(path + ".content.height", "Spacing height is not a valid length");
                }
                break;
            case EXCEL_HEADER:
                Object fields = settings.get("fields");
                if (!(fields instanceof List) && !(fields instanceof Map)) {
                    issues.warning(path + ".content.fields", "Excel header needs a list or map of fields");
                }
                break;
            default:
                break;
        }
        return type;
    }

    private void checkExerciseTable(Section settings, String path, Issues issues) {
        Object weeks = settings.get("weeks");
        if ("excel_weekly".equalsIgnoreCase(Values.asString(settings.get("format")).trim()) && weeks != null) {
            if (!Values.isNumericLike(weeks)) {
                issues.warning(path + ".content.weeks", "Field 'weeks' must be a number");
            } else if (Values.toInt(weeks, 0) > ExerciseTableSectionRenderer.MAX_WEEKS) {
                issues.warning(path + ".content.weeks", "Field 'weeks' is above "
                        + ExerciseTableSectionRenderer.MAX_WEEKS + "; only the first "
                        + ExerciseTableSectionRenderer.MAX_WEEKS + " weeks are rendered");
            }
        }
        Object columns = settings.get("columns");
        if (columns != null && !(columns instanceof List)) {
            issues.warning(path + ".content.columns", "Field 'columns' should be a list");
        }
    }

    private void checkVariables(Object raw, Issues issues) {
        if (raw == null) {
            return;
        }
        if (!(raw instanceof Map)) {
            issues.warning("variables", "Field 'variables' should be an object");
            return;
        }
        Values.asMap(raw).forEach((name, rawDefinition) -> {
            String path = "variables." + name;
            if (!(rawDefinition instanceof Map)) {
                issues.warning(path, "Variable definition should be an object");
                return;
            }
            Map<String, Object> definition = Values.asMap(rawDefinition);
            String type = definition.containsKey("type")
                    ? Values.asString(definition.get("type")).trim().toLowerCase(Locale.ROOT)
                    : "string";
            if (!VARIABLE_TYPES.contains(type)) {
                issues.warning(path + ".type", "Unknown variable type '" + type + "'", didYouMean(type, VARIABLE_TYPES));
            }
            Object defaultValue = definition.get("default");
            if ("image".equals(type) && defaultValue instanceof String
                    && !((String) defaultValue).isEmpty() && !((String) defaultValue).startsWith("data:")) {
                issues.warning(path + ".default", "Image default should be a data: URI");
            }
            if (Values.isTruthy(definition.get("required")) && !definition.containsKey("default")) {
                issues.warning(path, "Required variable '" + name + "' has no default");
            }
        });
    }

    private void checkQrCode(Object raw, Issues issues) {
        if (!(raw instanceof Map)) {
            return;
        }
        Map<String, Object> qr = Values.asMap(raw);
        if (Values.isTruthy(qr.get("enabled"))
                && Values.isBlank(qr.get("data_source")) && Values.isBlank(qr.get("custom_data"))) {
            issues.warning("qr_code", "QR code is enabled but has no data_source or custom_data");
        }
        Object position = qr.get("position");
        if (!Values.isBlank(position) && QrPosition.fromValue(position) == QrPosition.NONE
                && !"none".equalsIgnoreCase(Values.asString(position).trim())) {
            issues.warning("qr_code.position", "Unknown QR position '" + Values.asString(position)
                    + "', the QR code will not be drawn", didYouMean(Values.asString(position),
                    Arrays.asList("header", "footer", "inline", "separate")));
        }
        checkQrSource(qr, "qr_code", issues);
    }

    private void checkQrSource(Map<String, Object> qr, String path, Issues issues) {
        Object source = qr.get("data_source");
        if (Values.isBlank(source)) {
            return;
        }
        String value = Values.asString(source).trim().toLowerCase(Locale.ROOT);
        if (!QR_SOURCES.contains(value)) {
            issues.warning(path + ".data_source", "Unknown QR data_source '" + value + "'",
                    didYouMean(value, QR_SOURCES));
        } else if (QrPayloadResolver.CUSTOM_URL.equals(value) && Values.isBlank(qr.get("custom_data"))) {
            issues.warning(path + ".custom_data", "data_source custom_url requires custom_data");
        }
    }

    private double assessPerformance(Map<String, Object> config, Issues issues) {
        double score = 100;
        List<?> pages = Values.asList(config.get("pages"));
        if (pages.size() > MAX_PAGES) {
            issues.warning("pages", "Many pages may affect rendering performance");
            score -= 10;
        }
        int sections = 0;
        for (Object page : pages) {
            sections += Values.asList(Values.asMap(page).get("sections")).size();
        }
        if (sections > MAX_SECTIONS) {
            issues.warning("pages[].sections", "Many sections may affect rendering performance");
            score -= 15;
        }
        if (Values.asMap(config.get("variables")).size() > MAX_VARIABLES) {
            issues.warning("variables", "Many variables may affect rendering performance");
            score -= 10;
        }
        score = clamp(score);
        issues.info("", "Performance score: " + score);
        return score;
    }

    private double assessSecurity(Map<String, Object> config, Issues issues) {
        double score = 100;
        String serialized;
        try {
            serialized = ContentHashing.canonicalJson(config);
        } catch (IllegalArgumentException e) {
            serialized = String.valueOf(config);
        }
        if (serialized.toLowerCase(Locale.ROOT).contains(UNSAFE_MARKER)) {
            issues.warning("", "Potentially dangerous content detected (javascript:)");
            score -= 30;
        }
        score = clamp(score);
        issues.info("", "Security score: " + score);
        return score;
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }

    /**
     * "Did you mean" hint naming the closest candidate by edit distance.
     */
    static String didYouMean(String value, List<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        String needle = value.trim().toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            int distance = editDistance(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return best == null ? null : "Did you mean '" + best + "'?";
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
