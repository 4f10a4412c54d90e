package com.energy.reconcile.model;

import com.energy.reconcile.exception.StructuralDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 变量阈值目录。
 *
 * 启动时加载一次，之后只读，可在多个家庭的处理之间共享。
 * CSV 格式：表头 variable,kind,unit,min,max,description；
 * 界限为空或为 n.a. / NA / N/A 时表示不设限。
 */
public final class ThresholdCatalog {

    private static final Logger log = LoggerFactory.getLogger(ThresholdCatalog.class);

    /** 类路径上的默认阈值表 */
    public static final String DEFAULT_RESOURCE = "thresholds.csv";

    private static final Set<String> NA_VALUES = Set.of("", "n.a.", "na", "n/a");

    private final Map<String, VariableThreshold> thresholds;

    private ThresholdCatalog(Map<String, VariableThreshold> thresholds) {
        this.thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ThresholdCatalog empty() {
        return new ThresholdCatalog(Map.of());
    }

    /** 从类路径加载默认阈值表 */
    public static ThresholdCatalog loadDefault() {
        InputStream in = ThresholdCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new StructuralDataException("Threshold resource '" + DEFAULT_RESOURCE
                    + "' not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromCsv(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read threshold resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static ThresholdCatalog load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ThresholdCatalog catalog = fromCsv(reader);
            log.info("Loaded {} thresholds from {}", catalog.size(), path);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read threshold file " + path, e);
        }
    }

    /**
     * 解析阈值 CSV。
     *
     * @throws StructuralDataException 表头缺列、类型无法识别或界限不是数字
     */
    public static ThresholdCatalog fromCsv(Reader source) throws IOException {
        BufferedReader reader = (source instanceof BufferedReader)
                ? (BufferedReader) source : new BufferedReader(source);

        String headerLine = reader.readLine();
        if (headerLine == null) {
            throw new StructuralDataException("Threshold file is empty");
        }
        List<String> header = new ArrayList<>();
        for (String h : headerLine.split(",", -1)) {
            header.add(h.trim().toLowerCase(Locale.ROOT));
        }
        int nameIdx = requireHeader(header, "variable");
        int kindIdx = requireHeader(header, "kind");
        int unitIdx = header.indexOf("unit");
        int minIdx = requireHeader(header, "min");
        int maxIdx = requireHeader(header, "max");
        int descIdx = header.indexOf("description");

        Builder builder = builder();
        String line;
        int lineNo = 1;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank() || line.startsWith("#")) continue;

            String[] fields = line.split(",", -1);
            if (fields.length <= Math.max(nameIdx, Math.max(kindIdx, Math.max(minIdx, maxIdx)))) {
                throw new StructuralDataException("Threshold file line " + lineNo + " has only "
                        + fields.length + " fields");
            }
            VariableKind kind;
            try {
                kind = VariableKind.parse(fields[kindIdx]);
            } catch (IllegalArgumentException e) {
                throw new StructuralDataException("Threshold file line " + lineNo + ": " + e.getMessage(), e);
            }
            builder.add(new VariableThreshold(
                    fields[nameIdx].trim(),
                    kind,
                    field(fields, unitIdx),
                    parseBound(fields[minIdx], lineNo),
                    parseBound(fields[maxIdx], lineNo),
                    field(fields, descIdx)));
        }
        return builder.build();
    }

    private static int requireHeader(List<String> header, String name) {
        int idx = header.indexOf(name);
        if (idx < 0) {
            throw new StructuralDataException("Threshold file header is missing column '" + name + "'");
        }
        return idx;
    }

    private static String field(String[] fields, int idx) {
        if (idx < 0 || idx >= fields.length) return null;
        String value = fields[idx].trim();
        return value.isEmpty() ? null : value;
    }

    private static Double parseBound(String raw, int lineNo) {
        String value = raw.trim();
        if (NA_VALUES.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new StructuralDataException("Threshold file line " + lineNo
                    + ": bound '" + value + "' is not a number", e);
        }
    }

    // ==================== 查询 ====================

    public Optional<VariableThreshold> get(String variable) {
        return Optional.ofNullable(thresholds.get(variable));
    }

    public boolean contains(String variable) {
        return thresholds.containsKey(variable);
    }

    public Collection<VariableThreshold> getAll() {
        return thresholds.values();
    }

    /** 按目录顺序返回全部累计量变量名 */
    public List<String> getCumulativeColumns() {
        return namesOfKind(VariableKind.CUMULATIVE);
    }

    public List<String> namesOfKind(VariableKind kind) {
        List<String> names = new ArrayList<>();
        for (VariableThreshold t : thresholds.values()) {
            if (t.getKind() == kind) names.add(t.getName());
        }
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return thresholds.size();
    }

    public static final class Builder {
        private final Map<String, VariableThreshold> thresholds = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(VariableThreshold threshold) {
            if (thresholds.putIfAbsent(threshold.getName(), threshold) != null) {
                throw new StructuralDataException("Duplicate threshold for variable '"
                        + threshold.getName() + "'");
            }
            return this;
        }

        public Builder add(String name, VariableKind kind, Double min, Double max) {
            return add(new VariableThreshold(name, kind, null, min, max));
        }

        public ThresholdCatalog build() {
            return new ThresholdCatalog(thresholds);
        }
    }
}
