package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import co.fanki.flowengine.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the stored {@code nodes} and {@code edges} arrays.
 *
 * <p>The shape is the one the editor persists:</p>
 * <pre>
 * {"id":"question-1","type":"question","position":{"x":0,"y":0},
 *  "data":{"questionType":"yes_no","questionText":"...","options":[...]}}
 * {"id":"e1","source":"start-1","target":"question-1",
 *  "sourceHandle":null,"condition":{"type":"equals","value":"Red"}}
 * </pre>
 *
 * <p>Anything that cannot become a node, an edge or an answer (an unknown
 * node type, a node without an id, a condition value that is neither a
 * string nor a number) is rejected with a {@link DomainException} carrying
 * {@link DomainException#INVALID_FLOW_JSON}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowJsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowJsonCodec() {
    }

    // -- Graph ---------------------------------------------------------------

    /**
     * Decodes a graph from its stored arrays.
     *
     * @param nodes the {@code nodes} array, null means empty
     * @param edges the {@code edges} array, null means empty
     * @return the snapshot
     */
    public static FlowGraph readGraph(final JsonNode nodes,
            final JsonNode edges) {
        return FlowGraph.of(readNodes(nodes), readEdges(edges));
    }

    /**
     * Parses a {@code {"nodes":[...],"edges":[...]}} document.
     *
     * @param json the JSON text
     * @return the snapshot
     */
    public static FlowGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");
        try {
            final JsonNode root = MAPPER.readTree(json);
            return readGraph(root.get("nodes"), root.get("edges"));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Malformed flow JSON: "
                    + e.getOriginalMessage(),
                    DomainException.INVALID_FLOW_JSON, e);
        }
    }

    /**
     * Encodes a graph as a {@code {"nodes":[...],"edges":[...]}} object.
     *
     * @param graph the snapshot
     * @return the JSON tree
     */
    public static ObjectNode writeGraph(final FlowGraph graph) {
        final ObjectNode root = MAPPER.createObjectNode();
        root.set("nodes", writeNodes(graph.nodes()));
        root.set("edges", writeEdges(graph.edges()));
        return root;
    }

    /**
     * Serializes a graph to JSON text.
     *
     * @param graph the snapshot
     * @return the JSON text
     */
    public static String toJson(final FlowGraph graph) {
        try {
            return MAPPER.writeValueAsString(writeGraph(graph));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow", e);
        }
    }

    // -- Nodes ---------------------------------------------------------------

    /**
     * Decodes the stored node array.
     *
     * @param array the array, null means empty
     * @return the nodes in array order
     */
    public static List<FlowNode> readNodes(final JsonNode array) {
        final List<FlowNode> nodes = new ArrayList<>();
        for (final JsonNode element : elements(array, "nodes")) {
            nodes.add(readNode(element));
        }
        return nodes;
    }

    /**
     * Decodes one stored node.
     *
     * @param json the node object
     * @return the node
     */
    public static FlowNode readNode(final JsonNode json) {
        requireObject(json, "node");
        final String id = textOrNull(json, "id");
        try {
            final NodeType type = NodeType.fromWireName(
                    textOrNull(json, "type"));
            final JsonNode data = json.path("data");
            return new FlowNode(id, type, readPosition(json.get("position")),
                    readData(type, data));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Invalid node " + id + ": "
                    + e.getMessage(), DomainException.INVALID_FLOW_JSON, e);
        }
    }

    /**
     * Encodes nodes as the stored node array.
     *
     * @param nodes the nodes
     * @return the JSON array
     */
    public static ArrayNode writeNodes(final List<FlowNode> nodes) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (final FlowNode node : nodes) {
            array.add(writeNode(node));
        }
        return array;
    }

    /**
     * Encodes one node.
     *
     * @param node the node
     * @return the JSON object
     */
    public static ObjectNode writeNode(final FlowNode node) {
        final ObjectNode json = MAPPER.createObjectNode();
        json.put("id", node.id());
        json.put("type", node.type().wireName());
        final ObjectNode position = json.putObject("position");
        position.put("x", node.position().x());
        position.put("y", node.position().y());
        json.set("data", writeData(node.data()));
        return json;
    }

    private static Position readPosition(final JsonNode json) {
        if (json == null || json.isNull()) {
            return Position.ORIGIN;
        }
        return Position.of(json.path("x").asDouble(0),
                json.path("y").asDouble(0));
    }

    private static NodeData readData(final NodeType type,
            final JsonNode data) {
        return switch (type) {
            case START -> new StartNodeData(
                    textOrNull(data, "title"),
                    textOrNull(data, "description"),
                    textOrNull(data, "buttonText"));
            case END -> new EndNodeData(
                    textOrNull(data, "title"),
                    textOrNull(data, "description"),
                    data.path("showScore").asBoolean(false),
                    textOrNull(data, "redirectUrl"));
            case QUESTION -> readQuestion(data);
        };
    }

    private static QuestionNodeData readQuestion(final JsonNode data) {
        final QuestionType questionType = QuestionType.fromWireName(
                textOrNull(data, "questionType"));

        List<QuestionOption> options = null;
        final JsonNode optionsNode = data.get("options");
        if (optionsNode != null && optionsNode.isArray()) {
            options = new ArrayList<>();
            for (final JsonNode optionNode : optionsNode) {
                options.add(new QuestionOption(
                        textOrNull(optionNode, "id"),
                        textOrNull(optionNode, "text"),
                        intOrNull(optionNode, "points")));
            }
        }

        return QuestionNodeData.reconstitute(
                questionType,
                textOrNull(data, "questionText"),
                textOrNull(data, "description"),
                data.path("required").asBoolean(true),
                options,
                data.path("enableBranching").asBoolean(false),
                doubleOrNull(data, "minValue"),
                doubleOrNull(data, "maxValue"),
                textOrNull(data, "minLabel"),
                textOrNull(data, "maxLabel"),
                textOrNull(data, "placeholder"),
                intOrNull(data, "maxLength"),
                intOrNull(data, "minSelections"),
                intOrNull(data, "maxSelections"),
                intOrNull(data, "points"),
                readCorrectAnswer(data.get("correctAnswer")));
    }

    private static List<String> readCorrectAnswer(final JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        if (json.isArray()) {
            final List<String> values = new ArrayList<>();
            for (final JsonNode value : json) {
                values.add(scalarText(value));
            }
            return values;
        }
        return List.of(scalarText(json));
    }

    private static ObjectNode writeData(final NodeData data) {
        final ObjectNode json = MAPPER.createObjectNode();
        if (data instanceof StartNodeData start) {
            json.put("title", start.title());
            json.put("description", start.description());
            json.put("buttonText", start.buttonText());
        } else if (data instanceof EndNodeData end) {
            json.put("title", end.title());
            json.put("description", end.description());
            json.put("showScore", end.showScore());
            json.put("redirectUrl", end.redirectUrl());
        } else if (data instanceof QuestionNodeData question) {
            writeQuestion(question, json);
        }
        return json;
    }

    private static void writeQuestion(final QuestionNodeData question,
            final ObjectNode json) {
        json.put("questionType", question.questionType().wireName());
        json.put("questionText", question.questionText());
        json.put("description", question.description());
        json.put("required", question.required());
        if (question.hasOptionsList()) {
            final ArrayNode options = json.putArray("options");
            for (final QuestionOption option : question.options()) {
                final ObjectNode optionNode = options.addObject();
                optionNode.put("id", option.id());
                optionNode.put("text", option.text());
                if (option.points() != null) {
                    optionNode.put("points", option.points());
                }
            }
        }
        if (question.enableBranching()) {
            json.put("enableBranching", true);
        }
        putIfPresent(json, "minValue", question.minValue());
        putIfPresent(json, "maxValue", question.maxValue());
        putIfPresent(json, "minLabel", question.minLabel());
        putIfPresent(json, "maxLabel", question.maxLabel());
        putIfPresent(json, "placeholder", question.placeholder());
        putIfPresent(json, "maxLength", question.maxLength());
        putIfPresent(json, "minSelections", question.minSelections());
        putIfPresent(json, "maxSelections", question.maxSelections());
        putIfPresent(json, "points", question.points());
        final List<String> correct = question.correctAnswer();
        if (correct != null) {
            if (correct.size() == 1) {
                json.put("correctAnswer", correct.get(0));
            } else {
                final ArrayNode values = json.putArray("correctAnswer");
                correct.forEach(values::add);
            }
        }
    }

    // -- Edges ---------------------------------------------------------------

    /**
     * Decodes the stored edge array.
     *
     * @param array the array, null means empty
     * @return the edges in array order
     */
    public static List<FlowEdge> readEdges(final JsonNode array) {
        final List<FlowEdge> edges = new ArrayList<>();
        for (final JsonNode element : elements(array, "edges")) {
            edges.add(readEdge(element));
        }
        return edges;
    }

    /**
     * Decodes one stored edge.
     *
     * @param json the edge object
     * @return the edge
     */
    public static FlowEdge readEdge(final JsonNode json) {
        requireObject(json, "edge");
        final String id = textOrNull(json, "id");
        try {
            return new FlowEdge(id,
                    textOrNull(json, "source"),
                    textOrNull(json, "target"),
                    textOrNull(json, "sourceHandle"),
                    readCondition(json.get("condition")));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Invalid edge " + id + ": "
                    + e.getMessage(), DomainException.INVALID_FLOW_JSON, e);
        }
    }

    private static EdgeCondition readCondition(final JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        final ConditionType type = ConditionType.fromWireName(
                textOrNull(json, "type"));
        final JsonNode value = json.get("value");
        if (value != null && value.isNumber()) {
            return EdgeCondition.of(type, value.asDouble());
        }
        if (value != null && value.isTextual()) {
            return EdgeCondition.of(type, value.asText());
        }
        throw new DomainException("Condition value must be a string or a"
                + " number", DomainException.INVALID_FLOW_JSON);
    }

    /**
     * Encodes edges as the stored edge array.
     *
     * @param edges the edges
     * @return the JSON array
     */
    public static ArrayNode writeEdges(final List<FlowEdge> edges) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (final FlowEdge edge : edges) {
            final ObjectNode json = array.addObject();
            json.put("id", edge.id());
            json.put("source", edge.source());
            json.put("target", edge.target());
            json.put("sourceHandle", edge.sourceHandle());
            final EdgeCondition condition = edge.condition();
            if (condition == null) {
                json.putNull("condition");
            } else {
                final ObjectNode conditionNode = json.putObject("condition");
                conditionNode.put("type", condition.type().wireName());
                if (condition.numeric()) {
                    putNumber(conditionNode, "value",
                            Double.parseDouble(condition.value()));
                } else {
                    conditionNode.put("value", condition.value());
                }
            }
        }
        return array;
    }

    // -- Answers -------------------------------------------------------------

    /**
     * Decodes one answer: a string is text, an array is a list of choices,
     * a number is numeric.
     *
     * @param json the answer, may be null
     * @return the answer, or null when absent
     */
    public static AnswerValue readAnswer(final JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (json.isNumber()) {
            return AnswerValue.number(json.asDouble());
        }
        if (json.isArray()) {
            final List<String> values = new ArrayList<>();
            for (final JsonNode value : json) {
                values.add(scalarText(value));
            }
            return AnswerValue.choices(values);
        }
        return AnswerValue.text(scalarText(json));
    }

    /**
     * Decodes a {@code {nodeId: answer}} object.
     *
     * @param json the answers object, null means none
     * @return the answers keyed by node id, in document order
     */
    public static Map<String, AnswerValue> readAnswers(final JsonNode json) {
        final Map<String, AnswerValue> answers = new LinkedHashMap<>();
        if (json == null || json.isNull()) {
            return answers;
        }
        requireObject(json, "answers");
        final Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final AnswerValue answer = readAnswer(entry.getValue());
            if (answer != null) {
                answers.put(entry.getKey(), answer);
            }
        }
        return answers;
    }

    // -- Helpers -------------------------------------------------------------

    private static Iterable<JsonNode> elements(final JsonNode array,
            final String name) {
        if (array == null || array.isNull() || array.isMissingNode()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new DomainException("Expected '" + name + "' to be an"
                    + " array", DomainException.INVALID_FLOW_JSON);
        }
        return array;
    }

    private static void requireObject(final JsonNode json,
            final String what) {
        if (json == null || !json.isObject()) {
            throw new DomainException("Expected " + what + " to be an object",
                    DomainException.INVALID_FLOW_JSON);
        }
    }

    private static String scalarText(final JsonNode value) {
        if (value.isNumber()) {
            return AnswerValue.formatNumber(value.asDouble());
        }
        if (value.isContainerNode()) {
            throw new DomainException("Expected a string or a number",
                    DomainException.INVALID_FLOW_JSON);
        }
        return value.asText();
    }

    private static String textOrNull(final JsonNode node, final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && !fieldNode.isNull()
                ? fieldNode.asText() : null;
    }

    private static Integer intOrNull(final JsonNode node, final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && fieldNode.isNumber()
                ? fieldNode.asInt() : null;
    }

    private static Double doubleOrNull(final JsonNode node,
            final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && fieldNode.isNumber()
                ? fieldNode.asDouble() : null;
    }

    private static void putIfPresent(final ObjectNode json, final String field,
            final Object value) {
        if (value instanceof String text) {
            json.put(field, text);
        } else if (value instanceof Integer number) {
            json.put(field, number);
        } else if (value instanceof Double number) {
            putNumber(json, field, number);
        }
    }

    private static void putNumber(final ObjectNode json, final String field,
            final double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            json.put(field, (long) value);
        } else {
            json.put(field, value);
        }
    }
}
