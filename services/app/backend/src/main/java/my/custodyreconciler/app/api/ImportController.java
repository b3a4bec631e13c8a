package my.custodyreconciler.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.custodyreconciler.app.dto.ImportResultDto;
import my.custodyreconciler.app.dto.ImportRunDto;
import my.custodyreconciler.app.dto.PositionBatchRequest;
import my.custodyreconciler.app.importer.BankPosition;
import my.custodyreconciler.app.importer.PositionBatch;
import my.custodyreconciler.app.service.PositionImportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/imports")
@Tag(name = "Position Imports")
public class ImportController {
	private final PositionImportService importService;

	public ImportController(PositionImportService importService) {
		this.importService = importService;
	}

	@PostMapping("/positions")
	@Operation(summary = "Reconcile a parsed custodian batch")
	public ImportResultDto importPositions(@Valid @RequestBody PositionBatchRequest request, Principal principal) {
		return importService.importBatch(toBatch(request), actor(principal));
	}

	@PostMapping("/banks/{bankId}/latest")
	@Operation(summary = "Import the newest feed file of a bank")
	public ImportResultDto importLatest(@PathVariable String bankId, Principal principal) {
		return importService.importLatestFromFeed(bankId, actor(principal));
	}

	@GetMapping("/runs")
	@Operation(summary = "List recent import runs")
	public List<ImportRunDto> listRuns(@RequestParam(required = false) String bankId) {
		return importService.listRuns(bankId);
	}

	private String actor(Principal principal) {
		return principal == null ? "system" : principal.getName();
	}

	private PositionBatch toBatch(PositionBatchRequest request) {
		List<BankPosition> positions = request.positions().stream()
				.map(position -> new BankPosition(
						request.bankId(),
						position.portfolioCode(),
						position.accountNumber(),
						position.isin(),
						position.positionNumber(),
						position.instrumentCode(),
						position.securityName(),
						position.assetClass(),
						position.securityType(),
						position.currency(),
						position.quantity(),
						position.marketPrice(),
						position.marketValue(),
						position.costPrice(),
						position.snapshotDate(),
						position.bankSpecificData()))
				.toList();
		String sourceFile = request.sourceFile() == null || request.sourceFile().isBlank()
				? "api-" + request.fileDate()
				: request.sourceFile();
		return new PositionBatch(request.bankId(), request.fileDate(), sourceFile, positions);
	}
}
