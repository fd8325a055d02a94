package org.qargs;

/** Unwinds command resolution immediately when the user asks for help, the version or completion */
class ParseTermination extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final transient ParseResult theResult;

	ParseTermination(ParseResult result) {
		super(result.getType().name(), null, false, false);
		theResult = result;
	}

	ParseResult getResult() {
		return theResult;
	}
}
