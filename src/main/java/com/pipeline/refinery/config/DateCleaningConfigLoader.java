package com.pipeline.refinery.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pipeline.refinery.model.CleaningOptions;
import com.pipeline.refinery.model.CleaningPolicy;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.DecodedDate;
import com.pipeline.refinery.model.FieldSpec;
import com.pipeline.refinery.model.FormatRule;
import com.pipeline.refinery.model.OutputMode;
import com.pipeline.refinery.model.SerialDateFormatRule;
import com.pipeline.refinery.model.TemplateFormatRule;
import com.pipeline.refinery.model.ValidationResult;
import com.pipeline.refinery.normalize.FormatRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 日期清洗配置加载器。
 *
 * 用Jackson把YAML读成树，再逐个字段校验并构建强类型的 {@link DateCleaningConfig}。
 * 所有违规项先收集到 {@link ValidationResult}，最后统一抛出一个 {@link ConfigException}，
 * 每条错误都带有出错字段的完整路径。未知键只记录警告。
 */
public class DateCleaningConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DateCleaningConfigLoader.class);

    /** 类路径上的默认规则文件 */
    public static final String DEFAULT_RESOURCE = "date_formats.yaml";

    private static final String ROOT = "date_cleaning";

    private static final Set<String> ROOT_KEYS = new HashSet<>(Arrays.asList(
            "enabled", "output_format", "output_format_date_only", "date_fields", "parse_formats", "options"));
    private static final Set<String> FIELD_KEYS = new HashSet<>(Arrays.asList("name", "aliases", "has_time"));
    private static final Set<String> FORMAT_KEYS = new HashSet<>(Arrays.asList(
            "name", "template", "regex_pattern", "is_excel_serial", "description"));
    private static final Set<String> OPTION_KEYS = new HashSet<>(Arrays.asList(
            "on_parse_failure", "remove_decimal_zero", "log_details", "output_mode",
            "fallthrough_on_decode_failure"));

    /** 校验模板用的样例值 */
    private static final LocalDateTime OUTPUT_SAMPLE = LocalDateTime.of(2001, 2, 3, 14, 5, 6);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public DateCleaningConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigException(String.valueOf(path),
                    List.of(ROOT + ": configuration file not found: " + path));
        }
        try (InputStream input = Files.newInputStream(path)) {
            return load(input, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * 加载类路径上的默认规则集
     */
    public DateCleaningConfig loadDefault() {
        try (InputStream input = DateCleaningConfigLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new ConfigException(DEFAULT_RESOURCE,
                        List.of(ROOT + ": default configuration is missing from the classpath"));
            }
            return load(input, "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigException("Failed to read default configuration: " + e.getMessage(), e);
        }
    }

    public DateCleaningConfig load(InputStream input, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed YAML in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + source + ": " + e.getMessage(), e);
        }
        return parse(root, source);
    }

    DateCleaningConfig parse(JsonNode root, String source) {
        ValidationResult result = new ValidationResult();

        JsonNode section = root == null ? null : root.get(ROOT);
        if (section == null || section.isNull()) {
            result.addError(ROOT, "section is missing");
            throw new ConfigException(source, result.getErrors());
        }
        if (!section.isObject()) {
            result.addError(ROOT, "expected a mapping");
            throw new ConfigException(source, result.getErrors());
        }
        warnUnknownKeys(section, ROOT_KEYS, ROOT, result);

        boolean enabled = readBoolean(section, "enabled", true, ROOT, result);
        List<FieldSpec> fields = readDateFields(section.get("date_fields"), result);
        CleaningOptions options = readOptions(section.get("options"), result);
        boolean fallthrough = readFallthrough(section.get("options"), result);
        FormatRegistry registry = readParseFormats(section.get("parse_formats"), fallthrough, result);

        boolean serialRules = hasSerialRule(registry);
        String outputFormat = readOutputTemplate(section, "output_format",
                DateCleaningConfig.DEFAULT_OUTPUT_FORMAT, true, serialRules, result);
        String outputFormatDateOnly = readOutputTemplate(section, "output_format_date_only",
                DateCleaningConfig.DEFAULT_OUTPUT_FORMAT_DATE_ONLY, false, serialRules, result);

        for (String warning : result.getWarnings()) {
            log.warn("Configuration {}: {}", source, warning);
        }
        if (!result.isValid()) {
            throw new ConfigException(source, result.getErrors());
        }

        DateCleaningConfig config = new DateCleaningConfig(enabled, outputFormat, outputFormatDateOnly,
                fields, registry, options);
        log.info("Loaded date cleaning configuration from {}: {}", source, config);
        return config;
    }

    private List<FieldSpec> readDateFields(JsonNode node, ValidationResult result) {
        String path = ROOT + ".date_fields";
        List<FieldSpec> fields = new ArrayList<>();
        if (node == null || node.isNull()) {
            return fields;
        }
        if (!node.isArray()) {
            result.addError(path, "expected a list");
            return fields;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String itemPath = path + "[" + i + "]";
            JsonNode item = node.get(i);
            if (!item.isObject()) {
                result.addError(itemPath, "expected a mapping");
                continue;
            }
            warnUnknownKeys(item, FIELD_KEYS, itemPath, result);
            String name = readRequiredText(item, "name", itemPath, result);
            List<String> aliases = readStringList(item, "aliases", itemPath, result);
            boolean hasTime = readBoolean(item, "has_time", true, itemPath, result);
            if (name == null) {
                continue;
            }
            if (!names.add(name)) {
                result.addError(itemPath + ".name", "duplicate date field '" + name + "'");
                continue;
            }
            fields.add(new FieldSpec(name, aliases, hasTime));
        }
        return fields;
    }

    private FormatRegistry readParseFormats(JsonNode node, boolean fallthrough, ValidationResult result) {
        String path = ROOT + ".parse_formats";
        FormatRegistry.Builder builder = FormatRegistry.builder().fallthroughOnDecodeFailure(fallthrough);
        if (node == null || node.isNull()) {
            result.addError(path, "at least one parse format is required");
            return builder.build();
        }
        if (!node.isArray()) {
            result.addError(path, "expected a list");
            return builder.build();
        }
        if (node.size() == 0) {
            result.addError(path, "at least one parse format is required");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String itemPath = path + "[" + i + "]";
            JsonNode item = node.get(i);
            if (!item.isObject()) {
                result.addError(itemPath, "expected a mapping");
                continue;
            }
            warnUnknownKeys(item, FORMAT_KEYS, itemPath, result);
            String name = readRequiredText(item, "name", itemPath, result);
            String regex = readRequiredText(item, "regex_pattern", itemPath, result);
            boolean serial = readBoolean(item, "is_excel_serial", false, itemPath, result);
            String template = readOptionalText(item, "template", itemPath, result);
            String description = readOptionalText(item, "description", itemPath, result);

            if (regex != null && !isValidRegex(regex, itemPath + ".regex_pattern", result)) {
                regex = null;
            }
            if (!serial) {
                if (template == null) {
                    result.addError(itemPath + ".template", "required when is_excel_serial is false");
                } else if (!isValidTemplate(template, itemPath + ".template", result)) {
                    template = null;
                }
            }
            if (name != null && !names.add(name)) {
                result.addError(itemPath + ".name", "duplicate parse format '" + name + "'");
                continue;
            }
            if (name == null || regex == null || (!serial && template == null)) {
                continue;
            }
            FormatRule rule = serial
                    ? new SerialDateFormatRule(name, regex, description)
                    : new TemplateFormatRule(name, regex, template, description);
            builder.add(rule);
        }
        return builder.build();
    }

    private CleaningOptions readOptions(JsonNode node, ValidationResult result) {
        String path = ROOT + ".options";
        if (node == null || node.isNull()) {
            return CleaningOptions.defaults();
        }
        if (!node.isObject()) {
            result.addError(path, "expected a mapping");
            return CleaningOptions.defaults();
        }
        warnUnknownKeys(node, OPTION_KEYS, path, result);

        CleaningPolicy policy = CleaningPolicy.KEEP_ORIGINAL;
        String policyValue = readOptionalText(node, "on_parse_failure", path, result);
        if (policyValue != null) {
            policy = CleaningPolicy.fromConfigValue(policyValue);
            if (policy == null) {
                result.addError(path + ".on_parse_failure", "'" + policyValue
                        + "' is not one of keep_original, set_null, drop_row");
            }
        }

        OutputMode mode = OutputMode.REPLACE;
        String modeValue = readOptionalText(node, "output_mode", path, result);
        if (modeValue != null) {
            mode = OutputMode.fromConfigValue(modeValue);
            if (mode == null) {
                result.addError(path + ".output_mode", "'" + modeValue + "' is not one of replace, add_column");
            }
        }

        boolean removeDecimalZero = readBoolean(node, "remove_decimal_zero", true, path, result);
        boolean logDetails = readBoolean(node, "log_details", false, path, result);
        return new CleaningOptions(policy, removeDecimalZero, logDetails, mode);
    }

    private boolean readFallthrough(JsonNode options, ValidationResult result) {
        if (options == null || !options.isObject()) {
            return true;
        }
        return readBoolean(options, "fallthrough_on_decode_failure", true, ROOT + ".options", result);
    }

    /**
     * 读取输出模板，并用样例值试格式化：模板引用了输出值没有的字段（时区、带时间的纯日期模板等）
     * 时在加载阶段报错，而不是在清洗中途抛出异常。
     */
    private String readOutputTemplate(JsonNode section, String key, String defaultValue, boolean withTime,
                                      boolean serialRules, ValidationResult result) {
        String value = readOptionalText(section, key, ROOT, result);
        if (value == null) {
            return defaultValue;
        }
        String path = ROOT + "." + key;
        DateTimeFormatter formatter;
        try {
            formatter = DateTimeFormatter.ofPattern(value);
        } catch (IllegalArgumentException e) {
            result.addError(path, "invalid output template '" + value + "': " + e.getMessage());
            return defaultValue;
        }

        List<DecodedDate> samples = new ArrayList<>();
        samples.add(withTime ? DecodedDate.of(OUTPUT_SAMPLE) : DecodedDate.of(OUTPUT_SAMPLE.toLocalDate()));
        if (serialRules) {
            DecodedDate leapDay = DecodedDate.spreadsheetLeapDay();
            samples.add(withTime ? leapDay.withTime(LocalTime.MIDNIGHT) : leapDay);
        }
        for (DecodedDate sample : samples) {
            try {
                sample.format(formatter);
            } catch (DateTimeException e) {
                result.addError(path, "output template '" + value + "' cannot format " + sample + ": " + e.getMessage());
                return defaultValue;
            }
        }
        return value;
    }

    private static boolean hasSerialRule(FormatRegistry registry) {
        for (FormatRule rule : registry.getRules()) {
            if (rule.getKind() == FormatRule.Kind.SERIAL_NUMBER) {
                return true;
            }
        }
        return false;
    }

    private boolean isValidRegex(String regex, String path, ValidationResult result) {
        try {
            Pattern.compile(regex);
            return true;
        } catch (PatternSyntaxException e) {
            result.addError(path, "invalid regular expression: " + e.getDescription());
            return false;
        }
    }

    private boolean isValidTemplate(String template, String path, ValidationResult result) {
        DateTimeFormatter formatter;
        try {
            formatter = TemplateFormatRule.compile(template);
        } catch (IllegalArgumentException e) {
            result.addError(path, "invalid template '" + template + "': " + e.getMessage());
            return false;
        }
        if (template.indexOf('y') >= 0 && template.indexOf('G') < 0) {
            result.addWarning(path, "'y' is year-of-era and never resolves strictly without an era, use 'u'");
        }

        // 用模板格式化样例再读回，检查时间字段能否还原为一天中的时刻
        String sample;
        try {
            sample = formatter.format(OUTPUT_SAMPLE);
        } catch (DateTimeException e) {
            log.debug("Template '{}' cannot format a local date-time, read-back check skipped: {}",
                    template, e.getMessage());
            return true;
        }
        try {
            if (TemplateFormatRule.hasUnresolvedTime(formatter.parse(sample))) {
                result.addError(path, "time fields of template '" + template
                        + "' never resolve to a time of day, 'h' and 'K' need an AM/PM marker 'a'");
                return false;
            }
        } catch (DateTimeException e) {
            result.addWarning(path, "template '" + template + "' cannot read back its own output '"
                    + sample + "': " + e.getMessage());
        }
        return true;
    }

    private boolean readBoolean(JsonNode node, String key, boolean defaultValue, String path,
                                ValidationResult result) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            result.addError(path + "." + key, "expected true or false, got '" + value.asText() + "'");
            return defaultValue;
        }
        return value.booleanValue();
    }

    private String readRequiredText(JsonNode node, String key, String path, ValidationResult result) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            result.addError(path + "." + key, "is required");
            return null;
        }
        if (!value.isValueNode() || value.isBoolean() || value.asText().isBlank()) {
            result.addError(path + "." + key, "expected a non-blank string");
            return null;
        }
        return value.asText();
    }

    private String readOptionalText(JsonNode node, String key, String path, ValidationResult result) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            result.addError(path + "." + key, "expected a string");
            return null;
        }
        return value.asText();
    }

    private List<String> readStringList(JsonNode node, String key, String path, ValidationResult result) {
        List<String> values = new ArrayList<>();
        JsonNode list = node.get(key);
        if (list == null || list.isNull()) {
            return values;
        }
        if (!list.isArray()) {
            result.addError(path + "." + key, "expected a list");
            return values;
        }
        for (int i = 0; i < list.size(); i++) {
            JsonNode item = list.get(i);
            if (!item.isValueNode() || item.isNull() || item.isBoolean()) {
                result.addError(path + "." + key + "[" + i + "]", "expected a string");
                continue;
            }
            values.add(item.asText());
        }
        return values;
    }

    private void warnUnknownKeys(JsonNode node, Set<String> known, String path, ValidationResult result) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                result.addWarning(path + "." + name, "unknown key, ignored");
            }
        }
    }
}
