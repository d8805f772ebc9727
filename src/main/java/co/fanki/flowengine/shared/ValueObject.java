package co.fanki.flowengine.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable values of the flow model.
 *
 * <p>Nodes, edges and their payloads are never changed in place: every
 * edit produces a new value, and two values with the same attributes are
 * equal. Implementations validate their attributes on construction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
