package my.custodyreconciler.app.importer;

import java.time.LocalDate;
import java.util.List;

/**
 * All positions of one custodian file. The bank and file date apply to every position in the batch.
 */
public record PositionBatch(
		String bankId,
		LocalDate fileDate,
		String sourceFile,
		List<BankPosition> positions
) {
	public PositionBatch {
		positions = positions == null ? List.of() : List.copyOf(positions);
	}

	public PositionBatch withPositions(List<BankPosition> subset) {
		return new PositionBatch(bankId, fileDate, sourceFile, subset);
	}

	public boolean isEmpty() {
		return positions.isEmpty();
	}
}
