package ds_impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import ds_helper.Frame;
import ds_helper.InvalidReliabilityException;
import ds_helper.MassFunction;

public class ClassicalDiscountingTest {

	private static final Frame AB = Frame.of("a", "b");

	private static MassFunction m() {
		return MassFunction.builder(AB).assign("{a}", 0.4).assign("{b}", 0.3).assign("{a,b}", 0.3).build();
	}

	@Test
	void discountMovesTheRemainderToTheFrame() {
		MassFunction d = ClassicalDiscounting.discount(m(), 0.8);
		assertThat(d.mass("{a}")).isCloseTo(0.32, within(1e-12));
		assertThat(d.mass("{b}")).isCloseTo(0.24, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(0.44, within(1e-12));
		assertThat(d.totalMass()).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void extremeReliabilities() {
		MassFunction source = m();
		assertThat(ClassicalDiscounting.discount(source, 1.0)).isSameAs(source);
		assertThat(ClassicalDiscounting.discount(source, 0.0)).isEqualTo(MassFunction.vacuous(AB));
	}

	@Test
	void reliabilityOutsideTheUnitIntervalIsRejected() {
		assertThatThrownBy(() -> ClassicalDiscounting.discount(m(), 1.5))
				.isInstanceOf(InvalidReliabilityException.class)
				.hasMessageContaining("between 0 and 1")
				.satisfies(e -> assertThat(((InvalidReliabilityException) e).getRate()).isEqualTo(1.5));
		assertThatThrownBy(() -> ClassicalDiscounting.discount(m(), -0.1))
				.isInstanceOf(InvalidReliabilityException.class);
		assertThatThrownBy(() -> ClassicalDiscounting.discount(m(), Double.NaN))
				.isInstanceOf(InvalidReliabilityException.class);
	}

	@Test
	void discountingNeverLowersPlausibility() {
		MassFunction source = m();
		MassFunction d = ClassicalDiscounting.discount(source, 0.6);
		for (long h = 1; h <= AB.fullMask(); h++) {
			assertThat(d.plausibility(h)).isGreaterThanOrEqualTo(source.plausibility(h) - 1e-12);
			assertThat(d.belief(h)).isLessThanOrEqualTo(source.belief(h) + 1e-12);
		}
	}
}
