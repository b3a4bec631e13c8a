package my.custodyreconciler.app.importer;

import java.time.LocalDate;

public interface PositionFileParser {
	PositionBatch parse(byte[] payload, String filename, String bankId, LocalDate fileDate);
}
