package com.eda.defparser.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.FeatureValue;
import com.eda.defparser.model.FeatureValueVisitor;
import com.eda.defparser.model.Placement;

/**
 * Formats a COMPONENTS entry.
 *
 * <pre>
 * - compName modelName
 *     + PLACED ( x y ) orient
 *     + FEATURE value1 value2 ...
 * </pre>
 *
 * Placement is taken from the first of PLACED, FIXED, COVER that yields one.
 */
public class ComponentRecordFormatter implements RecordFormatter<ComponentRecord> {
    private static final Logger log = LoggerFactory.getLogger(ComponentRecordFormatter.class);

    static final List<String> PLACEMENT_KEYWORDS = List.of("PLACED", "FIXED", "COVER");

    @Override
    public ComponentRecord format(List<String> tokens, ParseDiagnostics diagnostics) {
        if (tokens.size() < 3) {
            log.warn("Invalid component format: {}", tokens);
            diagnostics.warn("Invalid component format: " + tokens);
            return ComponentRecord.unknown();
        }

        String instanceName = tokens.get(1);
        String cellName = tokens.get(2);
        Map<String, FeatureValue> features = parseFeatures(tokens);

        Placement placement = null;
        for (String keyword : PLACEMENT_KEYWORDS) {
            FeatureValue value = features.get(keyword);
            if (value == null) {
                continue;
            }
            placement = extractPlacement(instanceName, value, diagnostics);
            if (placement != null) {
                break;
            }
        }

        return ComponentRecord.builder()
                .instanceName(instanceName)
                .cellName(cellName)
                .features(Collections.unmodifiableMap(features))
                .placement(placement)
                .build();
    }

    @Override
    public ComponentRecord attachRawLines(ComponentRecord record, List<String> rawLines) {
        return record.withRawLines(rawLines);
    }

    private Map<String, FeatureValue> parseFeatures(List<String> tokens) {
        Map<String, FeatureValue> features = new LinkedHashMap<>();
        int i = 3;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (!Tokens.isKeyword(token)) {
                i++;
                continue;
            }

            String name = Tokens.keywordName(token);
            List<String> values = new ArrayList<>();
            i++;
            while (i < tokens.size() && !Tokens.isKeyword(tokens.get(i))) {
                values.add(tokens.get(i));
                i++;
            }
            features.put(name, FeatureValue.of(values));
        }
        return features;
    }

    private Placement extractPlacement(String instanceName, FeatureValue value, ParseDiagnostics diagnostics) {
        return value.accept(new FeatureValueVisitor<Placement>() {
            @Override
            public Placement visitScalar(FeatureValue.Scalar scalar) {
                // bare "( x y )" without orientation
                if (!scalar.getValue().startsWith("(")) {
                    return null;
                }
                return toPlacement(instanceName, scalar.getValue(), Placement.DEFAULT_ORIENTATION, diagnostics);
            }

            @Override
            public Placement visitMulti(FeatureValue.Multi multi) {
                if (multi.size() < 2) {
                    return null;
                }
                List<String> values = multi.getValues();
                return toPlacement(instanceName, values.get(0), values.get(1), diagnostics);
            }
        });
    }

    private Placement toPlacement(String instanceName, String coordinates, String orientation,
                                  ParseDiagnostics diagnostics) {
        String[] parts = Tokens.groupWords(coordinates);
        if (parts.length < 2) {
            return null;
        }
        try {
            return Placement.numeric(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), orientation);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse coordinates {} of component {}, keeping raw values", coordinates, instanceName);
            diagnostics.warn("Non-integer placement " + coordinates + " for component " + instanceName);
            return Placement.raw(parts[0], parts[1], orientation);
        }
    }
}
