package co.fanki.flowengine.flow.domain;

import java.util.List;

/**
 * Type-specific payload of a flow node.
 *
 * <p>There is one implementation per {@link NodeType}; a node's payload
 * always matches its type.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface NodeData {

    /**
     * Returns the node type this payload belongs to.
     *
     * @return the node type
     */
    NodeType nodeType();

    /**
     * Returns every author-written text of the screen that may embed
     * answer-pipe tokens. Null fields are skipped.
     *
     * @return the text fields, never null
     */
    List<String> textFields();
}
