package com.sitebuild.groupby.config;

import com.sitebuild.groupby.exception.ConfigException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the plugin config file.
 *
 * Format:
 * - Watcher: [tags] followed by root, slug, template, split, enabled,
 *   key_obj_fn, replace_none_key, children.order_by, pagination.*
 * - Group fields: [tags.fields] name = expression
 * - Key remapping: [tags.key_map] Blog = News
 * - Comments: lines starting with # or ;
 */
public class IniConfigParser {
    private static final Logger log = LoggerFactory.getLogger(IniConfigParser.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[\\s*([^\\]]+?)\\s*]$");
    private static final Pattern OPTION_PATTERN = Pattern.compile("^([^=]+?)\\s*=\\s*(.*)$");

    public IniDocument parse(Path configFile) throws IOException {
        List<String> lines = Files.readAllLines(configFile);
        return parse(lines, configFile.toString());
    }

    public IniDocument parse(List<String> lines, String filename) {
        IniDocument doc = new IniDocument(filename);
        String section = null;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            Matcher sectionMatcher = SECTION_PATTERN.matcher(trimmed);
            if (sectionMatcher.matches()) {
                section = sectionMatcher.group(1);
                doc.addSection(section);
                continue;
            }

            Matcher optionMatcher = OPTION_PATTERN.matcher(trimmed);
            if (!optionMatcher.matches()) {
                doc.addError("Line " + lineNum + ": Invalid line: " + trimmed);
                log.warn("Failed to parse config line {} in {}: {}", lineNum, filename, trimmed);
                continue;
            }
            if (section == null) {
                doc.addError("Line " + lineNum + ": Option outside of a section: " + trimmed);
                log.warn("Config option outside of a section at line {} in {}", lineNum, filename);
                continue;
            }
            doc.put(section, optionMatcher.group(1).trim(), unquote(optionMatcher.group(2).trim()));
        }

        return doc;
    }

    /**
     * Top-level sections, i.e. one per watched attribute.
     */
    public List<String> watcherSections(IniDocument doc) {
        List<String> result = new ArrayList<>();
        for (String section : doc.sections()) {
            if (!section.contains(".")) {
                result.add(section);
            }
        }
        return result;
    }

    /**
     * Turn one top-level section (with its sub-sections) into a config. The
     * config file itself is recorded as a dependency.
     */
    public GroupByConfig toConfig(IniDocument doc, String attribute) {
        if (doc.hasErrors()) {
            throw new ConfigException(doc.getErrors());
        }
        Map<String, Object> flat = new LinkedHashMap<>(doc.sectionAsMap(attribute));
        String prefix = attribute + ".";
        for (String section : doc.sections()) {
            if (!section.startsWith(prefix)) {
                continue;
            }
            String sub = section.substring(prefix.length());
            Map<String, String> values = doc.sectionAsMap(section);
            if ("fields".equals(sub) || "key_map".equals(sub)) {
                flat.put(sub, new LinkedHashMap<>(values));
            } else {
                values.forEach((k, v) -> flat.put(sub + "." + k, v));
            }
        }
        GroupByConfig config = GroupByConfig.fromMap(attribute, flat);
        config.addDependency(doc.getFilename());
        return config;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
