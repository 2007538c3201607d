package com.example.invoicesummary.domain.exception;

/**
 * Raised when a document line has no usable unit price, no amount, or a zero quantity.
 * The owning document is skipped in full, since partial output could not reconcile to its payable total.
 */
public class MalformedLineException extends DocumentProcessingException {

	/**
	 * Creates the exception and mentions the offending line.
	 *
	 * @param lineId identifier of the line as stated by the document
	 * @param reason what is wrong with the line
	 */
    public MalformedLineException(String lineId, String reason) {
        super("MALFORMED_LINE", "Line " + (lineId != null ? lineId : "?") + " is malformed: " + reason);
    }
}
