package com.eda.defparser.parser;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.HeaderInfo;
import com.eda.defparser.model.Units;

/**
 * Pulls design attributes out of the raw header statements, keyed by keyword.
 *
 * UNITS drives every coordinate conversion downstream, so it always has a value:
 * 1000 database units per micron when the statement is missing or unreadable.
 */
public class HeaderInfoExtractor {
    private static final Logger log = LoggerFactory.getLogger(HeaderInfoExtractor.class);

    private static final Pattern VERSION_PATTERN = Pattern.compile("VERSION\\s+([\\d.]+)");
    private static final Pattern DESIGN_PATTERN = Pattern.compile("DESIGN\\s+(\\S+)");
    private static final Pattern TECHNOLOGY_PATTERN = Pattern.compile("TECHNOLOGY\\s+(\\S+)");
    private static final Pattern UNITS_PATTERN = Pattern.compile("UNITS\\s+DISTANCE\\s+MICRONS\\s+(\\d+)");
    private static final Pattern DIVIDERCHAR_PATTERN = Pattern.compile("DIVIDERCHAR\\s+\"(.)\"");
    private static final Pattern BUSBITCHARS_PATTERN = Pattern.compile("BUSBITCHARS\\s+\"(..)\"");

    public HeaderInfo extract(Map<String, String> headerStatements, ParseDiagnostics diagnostics) {
        return HeaderInfo.builder()
                .version(find(headerStatements, "VERSION", VERSION_PATTERN).orElse(null))
                .design(find(headerStatements, "DESIGN", DESIGN_PATTERN).orElse(null))
                .technology(find(headerStatements, "TECHNOLOGY", TECHNOLOGY_PATTERN).orElse(null))
                .units(extractUnits(headerStatements, diagnostics))
                .dividerChar(find(headerStatements, "DIVIDERCHAR", DIVIDERCHAR_PATTERN).orElse(null))
                .busBitChars(find(headerStatements, "BUSBITCHARS", BUSBITCHARS_PATTERN).orElse(null))
                .build();
    }

    private Units extractUnits(Map<String, String> headerStatements, ParseDiagnostics diagnostics) {
        String statement = headerStatements.get("UNITS");
        if (statement == null) {
            log.warn("No UNITS found in DEF file, using default ({})", Units.DEFAULT_DATABASE_UNITS_PER_MICRON);
            diagnostics.warn("No UNITS statement, using " + Units.DEFAULT_DATABASE_UNITS_PER_MICRON
                    + " database units per micron");
            return Units.defaults();
        }

        Matcher matcher = UNITS_PATTERN.matcher(statement);
        if (matcher.find()) {
            try {
                int value = Integer.parseInt(matcher.group(1));
                log.info("UNITS: {} database units per micron", value);
                return Units.microns(value);
            } catch (NumberFormatException e) {
                // digits beyond int range fall through to the default
                log.debug("UNITS value out of range: {}", matcher.group(1));
            }
        }

        log.warn("Failed to parse UNITS DISTANCE MICRONS value from '{}'", statement);
        diagnostics.warn("Unreadable UNITS statement '" + statement + "', using "
                + Units.DEFAULT_DATABASE_UNITS_PER_MICRON + " database units per micron");
        return Units.defaults();
    }

    private Optional<String> find(Map<String, String> headerStatements, String keyword, Pattern pattern) {
        String statement = headerStatements.get(keyword);
        if (statement == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(statement);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
