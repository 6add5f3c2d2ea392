package io.formulaxform.core.casefile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formulaxform.core.error.CaseParseException;
import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.CaseModel;
import io.formulaxform.core.model.ConditionKind;
import io.formulaxform.core.model.FormulaKey;
import io.formulaxform.core.model.PackageVariant;
import io.formulaxform.core.model.SymbolDescriptor;
import io.formulaxform.core.model.TurbulenceModel;
import io.formulaxform.core.model.VolumeFormula;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads YAML case files into a {@link CaseModel}.
 *
 * <p>
 * Unknown keys are rejected before the tree is checked against the bundled schema, so a typo
 * is reported by name. Boundary items may omit {@code field} and {@code required} when their
 * condition (or turbulence model) implies them.
 *
 * <p>
 * Thread-safe.
 */
public final class CaseFileParser {

    private static final Logger LOG = LoggerFactory.getLogger(CaseFileParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final String KIND_PROPERTY = "property";
    private static final String KIND_SCALAR_DIFFUSIVITY = "scalar_diffusivity";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("package", "notebook", "volume", "boundary");

    private static final Set<String> KNOWN_VOLUME_KEYS =
            Set.of("property", "phase", "zone", "kind", "required", "symbols", "scalars", "expression");

    private static final Set<String> KNOWN_SYMBOL_KEYS = Set.of("name", "default", "field", "description");

    private static final Set<String> KNOWN_BOUNDARY_KEYS =
            Set.of("zone", "field", "condition", "turbulence-model", "required", "expression");

    private final CaseSchemaValidator schemaValidator;

    public CaseFileParser() {
        this(new CaseSchemaValidator());
    }

    public CaseFileParser(CaseSchemaValidator schemaValidator) {
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator must not be null");
    }

    /**
     * Parses the case file at {@code path}.
     *
     * @throws CaseParseException                               if the YAML is invalid or an item
     *                                                          names an unknown property, condition
     *                                                          or turbulence model
     * @throws io.formulaxform.core.error.CaseSchemaException if the tree violates the schema
     */
    public CaseModel parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new CaseParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parseTree(root, source);
    }

    /** Parses case YAML held in memory; {@code source} names it in errors. */
    public CaseModel parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new CaseParseException("Failed to parse YAML: " + e.getOriginalMessage(), e, null, source);
        }
        return parseTree(root, source);
    }

    private CaseModel parseTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new CaseParseException("Case file must be a YAML mapping", null, source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "case root", null, source);
        for (JsonNode item : root.path("volume")) {
            rejectUnknownKeys(item, KNOWN_VOLUME_KEYS, "volume item", null, source);
            for (JsonNode symbol : item.path("symbols")) {
                rejectUnknownKeys(symbol, KNOWN_SYMBOL_KEYS, "volume symbol", null, source);
            }
        }
        for (JsonNode item : root.path("boundary")) {
            rejectUnknownKeys(item, KNOWN_BOUNDARY_KEYS, "boundary item", null, source);
        }
        schemaValidator.validate(root, source);

        String packageId = root.get("package").asText();
        PackageVariant variant = PackageVariant.fromId(packageId)
                .orElseThrow(() -> new CaseParseException("Unknown package: '" + packageId + "'", null, source));

        Map<String, Double> notebook = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : root.path("notebook").properties()) {
            notebook.put(entry.getKey(), entry.getValue().asDouble());
        }

        List<VolumeFormula> volume = new ArrayList<>();
        for (JsonNode item : root.path("volume")) {
            volume.add(parseVolume(item, variant, source));
        }
        List<BoundaryFormula> boundary = new ArrayList<>();
        for (JsonNode item : root.path("boundary")) {
            boundary.add(parseBoundary(item, source));
        }
        LOG.info(
                "Loaded case {} ({}): {} notebook parameter(s), {} volume and {} boundary formula(s)",
                source,
                variant,
                notebook.size(),
                volume.size(),
                boundary.size());
        return new CaseModel(variant, notebook, volume, boundary);
    }

    private VolumeFormula parseVolume(JsonNode item, PackageVariant variant, String source) {
        String property = requireString(item, "property", null, source);
        String kind = optionalString(item, "kind");
        kind = kind == null ? KIND_PROPERTY : kind;
        if (KIND_PROPERTY.equals(kind) && !variant.authorizedProperties().contains(property)) {
            throw new CaseParseException(
                    "Property '" + property + "' cannot be defined by a formula for " + variant
                            + "; expected one of " + variant.authorizedProperties() + " or kind '"
                            + KIND_SCALAR_DIFFUSIVITY + "'",
                    null,
                    source);
        }
        String entityName = item.hasNonNull("phase") ? property + "_" + item.get("phase").asInt() : property;
        String zone = optionalString(item, "zone");
        String key = FormulaKey.volume(entityName, zone == null ? VolumeFormula.DEFAULT_ZONE : zone)
                .composite();

        List<SymbolDescriptor> symbols = new ArrayList<>();
        for (JsonNode symbol : item.path("symbols")) {
            symbols.add(parseSymbol(symbol, key, source));
        }
        return new VolumeFormula(
                requireString(item, "expression", key, source),
                stringList(item.path("required")),
                symbols,
                stringList(item.path("scalars")),
                entityName,
                zone);
    }

    private SymbolDescriptor parseSymbol(JsonNode symbol, String key, String source) {
        String name = requireString(symbol, "name", key, source);
        String defaultLiteral = optionalString(symbol, "default");
        String field = optionalString(symbol, "field");
        String description = optionalString(symbol, "description");
        if (defaultLiteral == null && field == null && description != null) {
            return SymbolDescriptor.fromDescription(name, description);
        }
        return new SymbolDescriptor(name, defaultLiteral, field);
    }

    private BoundaryFormula parseBoundary(JsonNode item, String source) {
        String zone = requireString(item, "zone", null, source);
        String conditionText = requireString(item, "condition", null, source);
        ConditionKind condition = ConditionKind.fromText(conditionText)
                .orElseThrow(() -> new CaseParseException(
                        "Unknown or ambiguous condition '" + conditionText + "' on boundary '" + zone
                                + "'; expected one of " + Arrays.toString(ConditionKind.values()),
                        null,
                        source));

        String field = optionalString(item, "field");
        List<String> derivedOutputs;
        if (condition == ConditionKind.TURBULENCE) {
            String label = requireString(item, "turbulence-model", null, source);
            TurbulenceModel model = TurbulenceModel.fromLabel(label)
                    .orElseThrow(() -> new CaseParseException(
                            "Unknown turbulence model '" + label + "' on boundary '" + zone + "'", null, source));
            field = model.fieldName();
            derivedOutputs = model.requiredOutputs();
        } else {
            if (field == null) {
                field = condition.defaultFieldName()
                        .orElseThrow(() -> new CaseParseException(
                                "Boundary '" + zone + "': condition " + condition + " needs a 'field'", null, source));
            }
            derivedOutputs = condition.defaultOutputs(field);
        }
        String key = FormulaKey.boundary(zone, field).composite();
        List<String> required = item.has("required") ? stringList(item.get("required")) : derivedOutputs;
        return new BoundaryFormula(requireString(item, "expression", key, source), required, field, zone, condition);
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static String requireString(JsonNode node, String field, String formulaKey, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw new CaseParseException("Missing or invalid required field: '" + field + "'", formulaKey, source);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String formulaKey, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new CaseParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    formulaKey,
                    source);
        }
    }
}
