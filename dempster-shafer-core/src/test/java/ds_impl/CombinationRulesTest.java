package ds_impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import ds_helper.Frame;
import ds_helper.MassFunction;

public class CombinationRulesTest {

	private static final Frame AB = Frame.of("a", "b");

	@Test
	void rulesAreFoundByName() {
		assertThat(CombinationRules.forName("dempster")).isEqualTo(CombinationRules.DEMPSTER);
		assertThat(CombinationRules.forName(" Dubois_Prade ")).isEqualTo(CombinationRules.DUBOIS_PRADE);
		assertThat(CombinationRules.forName("PCR6")).isEqualTo(CombinationRules.PCR6);
		assertThat(CombinationRules.BOLD.ruleName()).isEqualTo("bold");
		assertThatThrownBy(() -> CombinationRules.forName("murphy"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("dubois-prade");
	}

	@Test
	void everyRuleKeepsTotalMass() {
		List<MassFunction> sources = Arrays.asList(BasicCombinationTest.m1(), BasicCombinationTest.m2(),
				MassFunction.builder(AB).assign("{a}", 0.5).assign("{a,b}", 0.5).build());
		for (CombinationRules rule : CombinationRules.values()) {
			MassFunction m = rule.combineAll(sources);
			assertThat(m.totalMass()).as(rule.ruleName()).isCloseTo(1.0, within(1e-9));
			assertThat(m.frame()).as(rule.ruleName()).isEqualTo(AB);
		}
	}

	@Test
	void pcr6CombinesAllSourcesAtOnce() {
		MassFunction a = MassFunction.builder(AB).assign("{a}", 1.0).build();
		MassFunction b = MassFunction.builder(AB).assign("{b}", 1.0).build();
		MassFunction m = CombinationRules.PCR6.combineAll(Arrays.asList(a, a, b));
		assertThat(m.mass("{a}")).isCloseTo(2.0 / 3.0, within(1e-12));

		MassFunction folded = CombinationRules.PCR5.combineAll(Arrays.asList(a, a, b));
		assertThat(folded.mass("{a}")).isCloseTo(0.5, within(1e-12));
	}

	@Test
	void binaryRulesMatchTheirImplementations() {
		MassFunction m1 = BasicCombinationTest.m1();
		MassFunction m2 = BasicCombinationTest.m2();
		assertThat(CombinationRules.CONJUNCTIVE.combine(m1, m2).conflictMass()).isCloseTo(0.28, within(1e-12));
		assertThat(CombinationRules.YAGER.combine(m1, m2)).isEqualTo(AdvancedCombination.combineYager(m1, m2));
		assertThat(CombinationRules.DISJUNCTIVE.combine(m1, m2)).isEqualTo(BasicCombination.combineDisjunctive(m1, m2));
	}
}
