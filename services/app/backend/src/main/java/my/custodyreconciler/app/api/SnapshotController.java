package my.custodyreconciler.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.custodyreconciler.app.dto.SnapshotDto;
import my.custodyreconciler.app.service.PortfolioSnapshotService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/snapshots")
@Tag(name = "Portfolio Snapshots")
public class SnapshotController {
	private final PortfolioSnapshotService snapshotService;

	public SnapshotController(PortfolioSnapshotService snapshotService) {
		this.snapshotService = snapshotService;
	}

	@GetMapping
	@Operation(summary = "List snapshots of an owner, newest first")
	public List<SnapshotDto> listSnapshots(@RequestParam Long ownerId,
										   @RequestParam(required = false) String portfolioCode,
										   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
										   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
		return snapshotService.findSnapshots(ownerId, portfolioCode, from, to);
	}
}
