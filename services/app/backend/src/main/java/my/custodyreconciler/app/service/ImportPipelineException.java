package my.custodyreconciler.app.service;

/**
 * The batch could not be applied as a whole. Everything written so far is consistent and the same batch
 * can be imported again.
 */
public class ImportPipelineException extends RuntimeException {
	public ImportPipelineException(String message) {
		super(message);
	}

	public ImportPipelineException(String message, Throwable cause) {
		super(message, cause);
	}
}
