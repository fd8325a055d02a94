package org.qargs;

import org.qargs.validate.ArgumentDefinitionException;

/** Process exit codes for the outcomes of parsing */
public enum ExitCode {
	/** Parsing succeeded, or help, version or completion was requested */
	SUCCESS(0),
	/** Any other failure */
	FAILURE(1),
	/** The command line or the command declarations were invalid */
	VALIDATION_FAILURE(64);

	/** The numeric process exit code */
	public final int code;

	private ExitCode(int code) {
		this.code = code;
	}

	/**
	 * @param result The parse result
	 * @return The exit code for the result
	 */
	public static ExitCode forResult(ParseResult result) {
		return result.getType() == ParseResult.Type.ERROR ? VALIDATION_FAILURE : SUCCESS;
	}

	/**
	 * @param e The exception that ended the program
	 * @return The exit code for the exception
	 */
	public static ExitCode forThrowable(Throwable e) {
		if (e instanceof ArgumentParseException || e instanceof ArgumentDefinitionException)
			return VALIDATION_FAILURE;
		return FAILURE;
	}
}
