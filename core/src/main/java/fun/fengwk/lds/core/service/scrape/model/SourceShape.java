package fun.fengwk.lds.core.service.scrape.model;

/**
 * Source shape of a raw extraction output.
 *
 * @author fengwk
 */
public enum SourceShape {

    /**
     * schema.org entity from a JSON-LD block.
     */
    STRUCTURED_METADATA,

    /**
     * Listing entry mined from an inline script payload.
     */
    EMBEDDED_SCRIPT,

    /**
     * Listing card parsed from the DOM, already keyed by canonical field names.
     */
    DOM_CARD

}
