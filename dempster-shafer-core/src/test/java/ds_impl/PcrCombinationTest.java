package ds_impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import ds_helper.Frame;
import ds_helper.MassFunction;

public class PcrCombinationTest {

	private static final Frame AB = Frame.of("a", "b");

	private static MassFunction m3() {
		return MassFunction.builder(AB).assign("{a}", 0.8).assign("{b}", 0.2).build();
	}

	private static MassFunction m4() {
		return MassFunction.builder(AB).assign("{a}", 0.1).assign("{b}", 0.9).build();
	}

	@Test
	void pcr5GivesConflictBackProportionally() {
		MassFunction m = PcrCombination.combinePcr5(m3(), m4());
		double a = 0.08 + 0.8 * 0.8 * 0.9 / 1.7 + 0.2 * 0.1 * 0.1 / 0.3;
		double b = 0.18 + 0.8 * 0.9 * 0.9 / 1.7 + 0.2 * 0.2 * 0.1 / 0.3;
		assertThat(m.mass("{a}")).isCloseTo(a, within(1e-12));
		assertThat(m.mass("{b}")).isCloseTo(b, within(1e-12));
		assertThat(m.mass("{a}")).isCloseTo(0.425490196, within(1e-9));
		assertThat(m.totalMass()).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void pcr5WithoutConflictIsTheConjunctiveRule() {
		MassFunction s1 = MassFunction.builder(AB).assign("{a}", 0.3).assign("{a,b}", 0.7).build();
		MassFunction s2 = MassFunction.builder(AB).assign("{b}", 0.0).assign("{a,b}", 1.0).build();
		assertThat(PcrCombination.combinePcr5(s1, s2).approximatelyEquals(s1, 1e-12)).isTrue();
	}

	@Test
	void pcr6OfTwoSourcesIsPcr5() {
		MassFunction pcr6 = PcrCombination.combinePcr6(Arrays.asList(m3(), m4()));
		assertThat(pcr6.approximatelyEquals(PcrCombination.combinePcr5(m3(), m4()), 1e-12)).isTrue();
	}

	@Test
	void pcr6SplitsConflictAmongAllSources() {
		MassFunction a = MassFunction.builder().assign("{a}", 1.0).build();
		MassFunction b = MassFunction.builder().assign("{b}", 1.0).build();
		MassFunction m = PcrCombination.combinePcr6(Arrays.asList(a, a, b));
		assertThat(m.frame()).isEqualTo(AB);
		assertThat(m.mass("{a}")).isCloseTo(2.0 / 3.0, within(1e-12));
		assertThat(m.mass("{b}")).isCloseTo(1.0 / 3.0, within(1e-12));
	}

	@Test
	void pcr6OfThreeSourcesKeepsTotalMass() {
		MassFunction s3 = MassFunction.builder(AB).assign("{a}", 0.5).assign("{a,b}", 0.5).build();
		MassFunction m = PcrCombination.combinePcr6(Arrays.asList(m3(), m4(), s3));
		assertThat(m.totalMass()).isCloseTo(1.0, within(1e-12));
		assertThat(m.conflictMass()).isEqualTo(0.0);
		assertThat(m.mass("{a}")).isGreaterThan(0.0);
		assertThat(m.mass("{b}")).isGreaterThan(0.0);
	}

	@Test
	void pcr6SingleAndEmptyInputs() {
		MassFunction single = m3();
		assertThat(PcrCombination.combinePcr6(Collections.singletonList(single))).isSameAs(single);
		assertThatThrownBy(() -> PcrCombination.combinePcr6(Collections.<MassFunction>emptyList()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
