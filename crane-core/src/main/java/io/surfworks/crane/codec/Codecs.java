package io.surfworks.crane.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.crane.resource.Allocation;
import io.surfworks.crane.resource.AllocationGroup;
import io.surfworks.crane.resource.Logical;
import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.Resource;
import io.surfworks.crane.resource.ResourceException;
import io.surfworks.crane.resource.ResourceGroup;
import io.surfworks.crane.state.State;
import io.surfworks.crane.state.StateHistory;
import io.surfworks.crane.state.StateTransitionException;
import io.surfworks.crane.state.TransitionTable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * JSON codecs for resource values and state histories.
 *
 * <p>Wire formats:
 * <ul>
 *   <li>{@code Logical}: {@code {"num_gpu": 2}}</li>
 *   <li>{@code Physical}: {@code {"gpu_indices": [0, 1]}}</li>
 *   <li>{@code Allocation}: {@code {"total": R, "released": R}}</li>
 *   <li>{@code ResourceGroup}: {@code {"node-a": R, ...}}</li>
 *   <li>{@code AllocationGroup}: {@code {"node-a": Allocation, ...}}</li>
 *   <li>{@code StateHistory}: {@code {"timestamps": [1.5, 2.0], "states": [1, 2]}},
 *       states written as their integer flags</li>
 * </ul>
 */
public final class Codecs {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final JsonCodec<Logical> LOGICAL = new JsonCodec<>() {
        @Override
        public JsonNode encode(Logical value) {
            return NODES.objectNode().put("num_gpu", value.numGpu());
        }

        @Override
        public Logical decode(JsonNode node) throws CodecException {
            int numGpu = requireInt(requireField(node, "num_gpu"), "num_gpu");
            try {
                return Logical.gpus(numGpu);
            } catch (ResourceException e) {
                throw new CodecException("Invalid logical resource: " + e.getMessage(), e);
            }
        }
    };

    public static final JsonCodec<Physical> PHYSICAL = new JsonCodec<>() {
        @Override
        public JsonNode encode(Physical value) {
            ObjectNode root = NODES.objectNode();
            ArrayNode indices = root.putArray("gpu_indices");
            value.gpuIndices().forEach(indices::add);
            return root;
        }

        @Override
        public Physical decode(JsonNode node) throws CodecException {
            JsonNode indices = requireField(node, "gpu_indices");
            if (!indices.isArray()) {
                throw new CodecException("'gpu_indices' must be an array");
            }
            TreeSet<Integer> gpuIndices = new TreeSet<>();
            for (JsonNode index : indices) {
                gpuIndices.add(requireInt(index, "gpu_indices"));
            }
            try {
                return new Physical(gpuIndices);
            } catch (ResourceException e) {
                throw new CodecException("Invalid physical resource: " + e.getMessage(), e);
            }
        }
    };

    private Codecs() {
    }

    /**
     * Returns the codec of allocations of a resource unit.
     */
    public static <R extends Resource<R>> JsonCodec<Allocation<R>> allocation(JsonCodec<R> unit) {
        return new JsonCodec<>() {
            @Override
            public JsonNode encode(Allocation<R> value) {
                ObjectNode root = NODES.objectNode();
                root.set("total", unit.encode(value.total()));
                root.set("released", unit.encode(value.released()));
                return root;
            }

            @Override
            public Allocation<R> decode(JsonNode node) throws CodecException {
                R total = unit.decode(requireField(node, "total"));
                R released = unit.decode(requireField(node, "released"));
                try {
                    return Allocation.of(total, released);
                } catch (ResourceException e) {
                    throw new CodecException("Invalid allocation: " + e.getMessage(), e);
                }
            }
        };
    }

    /**
     * Returns the codec of resource groups of a resource unit.
     */
    public static <R extends Resource<R>> JsonCodec<ResourceGroup<R>> resourceGroup(JsonCodec<R> unit) {
        return new JsonCodec<>() {
            @Override
            public JsonNode encode(ResourceGroup<R> value) {
                return encodeMapping(value.asMap(), unit);
            }

            @Override
            public ResourceGroup<R> decode(JsonNode node) throws CodecException {
                Map<String, R> resources = decodeMapping(node, unit);
                try {
                    return ResourceGroup.of(resources);
                } catch (IllegalArgumentException e) {
                    throw new CodecException("Invalid resource group: " + e.getMessage(), e);
                }
            }
        };
    }

    /**
     * Returns the codec of allocation groups of a resource unit.
     */
    public static <R extends Resource<R>> JsonCodec<AllocationGroup<R>> allocationGroup(JsonCodec<R> unit) {
        JsonCodec<Allocation<R>> allocationCodec = allocation(unit);
        return new JsonCodec<>() {
            @Override
            public JsonNode encode(AllocationGroup<R> value) {
                return encodeMapping(value.asMap(), allocationCodec);
            }

            @Override
            public AllocationGroup<R> decode(JsonNode node) throws CodecException {
                Map<String, Allocation<R>> allocations = decodeMapping(node, allocationCodec);
                try {
                    return AllocationGroup.of(allocations);
                } catch (IllegalArgumentException e) {
                    throw new CodecException("Invalid allocation group: " + e.getMessage(), e);
                }
            }
        };
    }

    /**
     * Returns the codec of state histories of a state type.
     */
    public static <S extends Enum<S> & State<S>> JsonCodec<StateHistory<S>> stateHistory(Class<S> type) {
        return new JsonCodec<>() {
            @Override
            public JsonNode encode(StateHistory<S> value) {
                ObjectNode root = NODES.objectNode();
                ArrayNode timestamps = root.putArray("timestamps");
                value.timestamps().forEach(timestamps::add);
                ArrayNode states = root.putArray("states");
                value.states().forEach(state -> states.add(state.flag()));
                return root;
            }

            @Override
            public StateHistory<S> decode(JsonNode node) throws CodecException {
                JsonNode timestampsNode = requireArray(requireField(node, "timestamps"), "timestamps");
                JsonNode statesNode = requireArray(requireField(node, "states"), "states");

                List<Double> timestamps = new ArrayList<>();
                for (JsonNode timestamp : timestampsNode) {
                    if (!timestamp.isNumber()) {
                        throw new CodecException("'timestamps' must hold numbers, got " + timestamp);
                    }
                    timestamps.add(timestamp.doubleValue());
                }

                try {
                    TransitionTable<S> table = type.getEnumConstants()[0].transitions();
                    List<S> states = new ArrayList<>();
                    for (JsonNode state : statesNode) {
                        states.add(table.fromFlag(requireInt(state, "states")));
                    }
                    return StateHistory.of(type, timestamps, states);
                } catch (IllegalArgumentException | StateTransitionException e) {
                    throw new CodecException("Invalid state history: " + e.getMessage(), e);
                }
            }
        };
    }

    /**
     * Encodes a value as a JSON string.
     */
    public static <T> String toJson(JsonCodec<T> codec, T value) {
        return codec.encode(value).toString();
    }

    /**
     * Decodes a value from a JSON string.
     *
     * @throws CodecException if the string is not valid JSON or describes an invalid value
     */
    public static <T> T fromJson(JsonCodec<T> codec, String json) throws CodecException {
        JsonNode node;
        try {
            node = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CodecException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return codec.decode(node);
    }

    private static <V> ObjectNode encodeMapping(Map<String, V> values, JsonCodec<V> codec) {
        ObjectNode root = NODES.objectNode();
        values.forEach((key, value) -> root.set(key, codec.encode(value)));
        return root;
    }

    private static <V> Map<String, V> decodeMapping(JsonNode node, JsonCodec<V> codec) throws CodecException {
        if (node == null || !node.isObject()) {
            throw new CodecException("Expected a JSON object, got " + node);
        }
        Map<String, V> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), codec.decode(field.getValue()));
        }
        return values;
    }

    private static JsonNode requireField(JsonNode node, String field) throws CodecException {
        if (node == null || !node.isObject()) {
            throw new CodecException("Expected a JSON object with '" + field + "', got " + node);
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new CodecException("Missing field '" + field + "'");
        }
        return value;
    }

    private static JsonNode requireArray(JsonNode node, String field) throws CodecException {
        if (!node.isArray()) {
            throw new CodecException("'" + field + "' must be an array");
        }
        return node;
    }

    private static int requireInt(JsonNode node, String field) throws CodecException {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new CodecException("'" + field + "' must hold integers, got " + node);
        }
        return node.intValue();
    }
}
