package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.shared.DomainException;

import java.util.Locale;

/**
 * The primary axis a layout reads along.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LayoutDirection {

    /** Top to bottom: ranks grow along y. */
    TB,

    /** Left to right: ranks grow along x. */
    LR;

    /**
     * Resolves a direction from its code, ignoring case.
     *
     * @param code {@code TB} or {@code LR}; null or blank means {@code LR}
     * @return the direction
     * @throws DomainException if the code is unknown
     */
    public static LayoutDirection fromCode(final String code) {
        if (code == null || code.isBlank()) {
            return LR;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Unknown layout direction: " + code,
                    DomainException.INVALID_LAYOUT, e);
        }
    }

    public boolean isHorizontal() {
        return this == LR;
    }
}
