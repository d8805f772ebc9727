package co.fanki.flowengine.flow.domain;

/**
 * How serious a validation issue is.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Severity {

    /** Blocks publishing. */
    ERROR,

    /** Surfaced to the author; publishing is still allowed. */
    WARNING
}
