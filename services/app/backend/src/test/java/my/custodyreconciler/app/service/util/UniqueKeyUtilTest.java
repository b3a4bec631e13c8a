package my.custodyreconciler.app.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UniqueKeyUtilTest {
	@Test
	void prefersIsinOverOtherIdentifiers() {
		assertThat(UniqueKeyUtil.rawKey("bank_a", "PF-7", " ch0012345678 ", "P-1", "INS", "CHF"))
				.isEqualTo("bank_a|PF-7|CH0012345678");
	}

	@Test
	void fallsBackToPositionNumberThenInstrumentCode() {
		assertThat(UniqueKeyUtil.rawKey("bank_a", "PF-7", null, "P-1", "INS", "CHF"))
				.isEqualTo("bank_a|PF-7|P-1");
		assertThat(UniqueKeyUtil.rawKey("bank_a", "PF-7", "", " ", "CASH-CHF", "CHF"))
				.isEqualTo("bank_a|PF-7|CASH-CHF|CHF");
	}

	@Test
	void unidentifiedPositionsShareOneKey() {
		assertThat(UniqueKeyUtil.rawKey("bank_a", "PF-7", null, null, null, "EUR"))
				.isEqualTo("bank_a|PF-7|" + UniqueKeyUtil.UNIDENTIFIED);
	}

	@Test
	void keyIsStableSha256Hex() {
		String first = UniqueKeyUtil.key("bank_a", "PF-7", "CH0012345678", null, null, "CHF");
		String second = UniqueKeyUtil.key("bank_a", "PF-7", "ch0012345678", "other", null, "EUR");

		assertThat(first).hasSize(64).matches("[0-9a-f]+");
		assertThat(first).isEqualTo(second);
		assertThat(UniqueKeyUtil.key("bank_b", "PF-7", "CH0012345678", null, null, "CHF")).isNotEqualTo(first);
	}
}
