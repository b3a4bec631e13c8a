package my.custodyreconciler.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.custodyreconciler.app.dto.AlertDto;
import my.custodyreconciler.app.service.RiskAlertService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
@Tag(name = "Risk Alerts")
public class AlertController {
	private final RiskAlertService riskAlertService;

	public AlertController(RiskAlertService riskAlertService) {
		this.riskAlertService = riskAlertService;
	}

	@GetMapping
	@Operation(summary = "List open risk alerts")
	public List<AlertDto> listAlerts(@RequestParam(required = false) String eventType,
									 @RequestParam(required = false) Long bankAccountId) {
		return riskAlertService.listAlerts(eventType, bankAccountId);
	}
}
