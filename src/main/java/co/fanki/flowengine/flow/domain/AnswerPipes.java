package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answer piping: earlier answers substituted into later screen text.
 *
 * <p>A pipe token reads {@code {{nodeId:label}}}. The node id cannot
 * contain {@code :} or <code>}</code>, the label cannot contain
 * <code>}</code>. The label is a human readable hint shown in the editor;
 * only the node id is used to look up the answer. Text that does not match
 * the token grammar, such as {@code {{q1}}}, is left untouched.</p>
 *
 * <p>Every call uses its own {@link Matcher}, so calls are independent of
 * each other and safe from any thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnswerPipes {

    /** Text shown in place of a token whose answer is missing. */
    public static final String DEFAULT_FALLBACK = "...";

    private static final Pattern TOKEN =
            Pattern.compile("\\{\\{([^:}]+):([^}]+)\\}\\}");

    private AnswerPipes() {
    }

    /**
     * Replaces every token with the answer given to its node.
     *
     * @param text the screen text
     * @param answers the answers keyed by node id
     * @return the text with answers piped in, missing ones as {@code ...}
     */
    public static String resolve(final String text,
            final Map<String, AnswerValue> answers) {
        return resolve(text, answers, DEFAULT_FALLBACK);
    }

    /**
     * Replaces every token with the answer given to its node.
     *
     * <p>Choices are joined with a comma; numbers render without a trailing
     * {@code .0}. A missing answer, empty text or an empty choice list is
     * replaced by the fallback.</p>
     *
     * @param text the screen text, may be null
     * @param answers the answers keyed by node id
     * @param fallback the replacement for missing answers
     * @return the resolved text, or null if the text was null
     */
    public static String resolve(final String text,
            final Map<String, AnswerValue> answers, final String fallback) {
        Preconditions.requireNonNull(answers, "Answers are required");
        if (text == null) {
            return null;
        }
        final String replacement = fallback == null ? DEFAULT_FALLBACK
                : fallback;
        return TOKEN.matcher(text).replaceAll(match -> {
            final AnswerValue answer = answers.get(match.group(1));
            final String value = answer == null || answer.isEmpty()
                    ? replacement : answer.display();
            return Matcher.quoteReplacement(value);
        });
    }

    /**
     * Renders tokens as {@code @label}, the form shown on the canvas.
     *
     * @param text the screen text, may be null
     * @return the display text, or null if the text was null
     */
    public static String displayText(final String text) {
        if (text == null) {
            return null;
        }
        return TOKEN.matcher(text).replaceAll(match ->
                Matcher.quoteReplacement("@" + match.group(2)));
    }

    /**
     * Checks if the text contains at least one token.
     *
     * @param text the screen text, may be null
     * @return true if a token is present
     */
    public static boolean hasReferences(final String text) {
        return text != null && TOKEN.matcher(text).find();
    }

    /**
     * Lists the node ids the text pipes answers from.
     *
     * @param text the screen text, may be null
     * @return the distinct referenced ids in order of first appearance
     */
    public static List<String> referencedNodeIds(final String text) {
        final Set<String> ids = new LinkedHashSet<>();
        if (text != null) {
            final Matcher matcher = TOKEN.matcher(text);
            while (matcher.find()) {
                ids.add(matcher.group(1));
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Lists the referenced node ids that are no longer in the flow.
     *
     * @param text the screen text, may be null
     * @param existingNodeIds the ids of the nodes in the flow
     * @return the broken ids, one entry per token, in text order
     */
    public static List<String> findBrokenReferences(final String text,
            final Set<String> existingNodeIds) {
        Preconditions.requireNonNull(existingNodeIds,
                "Existing node ids are required");
        final List<String> broken = new ArrayList<>();
        if (text == null) {
            return broken;
        }
        final Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            if (!existingNodeIds.contains(matcher.group(1))) {
                broken.add(matcher.group(1));
            }
        }
        return broken;
    }

    /**
     * Builds the token inserted when the author picks an earlier answer.
     *
     * @param nodeId the answered question's node id
     * @param label the human readable label
     * @return the token
     */
    public static String buildToken(final String nodeId, final String label) {
        Preconditions.requireNonBlank(nodeId, "Node id is required");
        Preconditions.requireNonBlank(label, "Label is required");
        Preconditions.require(nodeId.indexOf(':') < 0
                && nodeId.indexOf('}') < 0,
                "Node id cannot contain ':' or '}'");
        Preconditions.require(label.indexOf('}') < 0,
                "Label cannot contain '}'");
        return "{{" + nodeId + ":" + label + "}}";
    }
}
