package com.fleet.admin.common.utils;

import com.fleet.admin.common.enums.Placeholder;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板占位符替换，仅识别 {@link Placeholder} 中列出的名称
 */
@Slf4j
public class PlaceholderUtil {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{\\s*([A-Za-z_]+)\\s*}}");

    private PlaceholderUtil() {
    }

    /**
     * 已知占位符替换为对应值（无值时替换为空串），未知占位符原样保留
     */
    public static String resolve(String template, Map<Placeholder, String> values) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String name = matcher.group(1);
            Placeholder placeholder = Placeholder.of(name);
            String replacement;
            if (placeholder == null) {
                log.warn("模板中存在未知占位符: {}", name);
                replacement = matcher.group(0);
            } else {
                String value = values.get(placeholder);
                replacement = value == null ? "" : value;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
