package org.eregs.regml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool settings, read from YAML:
 *
 * <pre>
 * noticeOrder:
 *   "1026":
 *     - 2013-22752
 *     - 2014-18838
 * </pre>
 *
 * Passed explicitly to whatever needs it.
 */
public final class RegmlSettings {

    public static final String DEFAULT_RESOURCE = "regml.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Per CFR part, document numbers in the order their notices must be applied. */
    public Map<String, List<String>> noticeOrder = new LinkedHashMap<>();

    public static RegmlSettings defaults() {
        return new RegmlSettings();
    }

    /** {@value #DEFAULT_RESOURCE} from the classpath, or defaults if there is none. */
    public static RegmlSettings load() {
        try (InputStream in = RegmlSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return defaults();
            return normalize(YAML_MAPPER.readValue(in, RegmlSettings.class));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static RegmlSettings load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return normalize(YAML_MAPPER.readValue(in, RegmlSettings.class));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read settings " + file, e);
        }
    }

    /** Custom order for {@code part}; empty when none is configured. */
    public List<String> noticeOrderFor(String part) {
        List<String> order = noticeOrder.get(part);
        return order == null ? new ArrayList<>() : order;
    }

    private static RegmlSettings normalize(RegmlSettings s) {
        if (s == null) return defaults();
        if (s.noticeOrder == null) s.noticeOrder = new LinkedHashMap<>();
        return s;
    }
}
