package co.fanki.flowengine.flow.domain;

import java.util.UUID;

/**
 * Source of the unique suffixes used for node, edge and option ids.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Returns a suffix never returned before by this generator.
     *
     * @return the unique suffix
     */
    String nextId();

    /**
     * Returns a generator backed by random UUIDs.
     *
     * @return the generator
     */
    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
