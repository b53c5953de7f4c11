package ds_impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ds_helper.Frame;
import ds_helper.InvalidPartitionException;
import ds_helper.InvalidReliabilityException;
import ds_helper.MassFunction;
import ds_helper.MassValidationException;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;

public class ContextualDiscountingTest {

	private static final Frame AB = Frame.of("a", "b");
	private static final Frame ABC = Frame.of("a", "b", "c");

	private static MassFunction m() {
		return MassFunction.builder(AB).assign("{a}", 0.6).assign("{a,b}", 0.4).build();
	}

	private static Map<String, Double> rates(Object... pairs) {
		Map<String, Double> map = new HashMap<String, Double>();
		for (int i = 0; i < pairs.length; i += 2)
			map.put((String) pairs[i], (Double) pairs[i + 1]);
		return map;
	}

	@Test
	void elementRatesSpreadMassToSupersets() {
		MassFunction d = ContextualDiscounting.discountContextual(m(), rates("a", 0.2, "b", 0.5));
		assertThat(d.mass("{a}")).isCloseTo(6.0 / 11.0, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(5.0 / 11.0, within(1e-12));
		assertThat(d.isNormalized()).isTrue();
	}

	@Test
	void zeroAndFullRates() {
		MassFunction source = m();
		assertThat(ContextualDiscounting.discountContextual(source, rates("a", 0.0))).isSameAs(source);
		assertThat(ContextualDiscounting.discountContextual(source, rates("a", 1.0, "b", 1.0)))
				.isEqualTo(MassFunction.vacuous(AB));
	}

	@Test
	void thetaPartitionBlocksShareOneRate() {
		MassFunction source = MassFunction.builder(ABC).assign("{a}", 0.5).assign("{a,b,c}", 0.5).build();
		List<List<String>> partition = Arrays.asList(Arrays.asList("a"), Arrays.asList("b", "c"));
		Map<List<String>, Double> alphas = new HashMap<List<String>, Double>();
		alphas.put(Arrays.asList("a"), 0.2);
		alphas.put(Arrays.asList("b", "c"), 0.3);

		MassFunction d = ContextualDiscounting.discountThetaContextual(source, partition, alphas);
		assertThat(d.mass("{a}")).isCloseTo(0.4 / 1.04, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(0.12 / 1.04, within(1e-12));
		assertThat(d.mass("{a,c}")).isCloseTo(0.12 / 1.04, within(1e-12));
		assertThat(d.mass("{a,b,c}")).isCloseTo(0.4 / 1.04, within(1e-12));
	}

	@Test
	void singletonPartitionIsElementWiseDiscounting() {
		MassFunction source = MassFunction.builder(ABC).assign("{a}", 0.3).assign("{b,c}", 0.3).assign("{a,b,c}", 0.4).build();
		List<List<String>> partition = Arrays.asList(Arrays.asList("a"), Arrays.asList("b"), Arrays.asList("c"));
		Map<List<String>, Double> alphas = new HashMap<List<String>, Double>();
		alphas.put(Arrays.asList("a"), 0.1);
		alphas.put(Arrays.asList("b"), 0.4);
		alphas.put(Arrays.asList("c"), 0.7);

		MassFunction theta = ContextualDiscounting.discountThetaContextual(source, partition, alphas);
		MassFunction element = ContextualDiscounting.discountContextual(source, rates("a", 0.1, "b", 0.4, "c", 0.7));
		assertThat(theta.approximatelyEquals(element, 1e-12)).isTrue();
	}

	@Test
	void generalizationMatrixCoefficients() {
		Long2ObjectMap<Long2DoubleMap> g = ContextualDiscounting.generalizationMatrix(ABC, rates("a", 0.2, "b", 0.3, "c", 0.4));
		long abc = ABC.maskOf("a", "b", "c");
		long ab = ABC.maskOf("a", "b");
		assertThat(g.get(abc).get(ab)).isCloseTo(0.8 * 0.7 * 0.4, within(1e-12));
		assertThat(g.get(ab).get(ab)).isCloseTo(0.8 * 0.7, within(1e-12));
		assertThat(g.get(ab).containsKey(ABC.maskOf("c"))).isFalse();
		assertThat(g.size()).isEqualTo(7);

		List<List<String>> partition = Arrays.asList(Arrays.asList("a"), Arrays.asList("b", "c"));
		Map<List<String>, Double> alphas = Collections.singletonMap(Arrays.asList("b", "c"), 0.3);
		Long2ObjectMap<Long2DoubleMap> theta = ContextualDiscounting.thetaGeneralizationMatrix(ABC, partition, alphas);
		assertThat(theta.get(abc).get(ABC.maskOf("a"))).isCloseTo(0.3, within(1e-12));
		assertThat(theta.get(abc).get(abc)).isCloseTo(0.7, within(1e-12));
	}

	@Test
	void perContextReliabilityKeepsOtherFocalSets() {
		Map<List<String>, Double> reliabilities = new LinkedHashMap<List<String>, Double>();
		reliabilities.put(Arrays.asList("a"), 0.5);
		MassFunction d = ContextualDiscounting.discountPerContext(m(), reliabilities);
		assertThat(d.mass("{a}")).isCloseTo(0.3, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(0.7, within(1e-12));
		assertThat(d.totalMass()).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void perHypothesisReliabilityOnlyTouchesExactFocalSets() {
		MassFunction source = MassFunction.builder(ABC).assign("{a}", 0.6).assign("{a,b}", 0.4).build();
		Map<List<String>, Double> reliabilities = new LinkedHashMap<List<String>, Double>();
		reliabilities.put(Arrays.asList("a"), 0.5);
		reliabilities.put(Arrays.asList("b"), 0.1);
		MassFunction d = ContextualDiscounting.discountPerHypothesis(source, reliabilities);
		assertThat(d.mass("{a}")).isCloseTo(0.3, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(0.4, within(1e-12));
		assertThat(d.mass("{a,b,c}")).isCloseTo(0.3, within(1e-12));
		assertThat(d.mass("{b}")).isEqualTo(0.0);
		assertThat(d.totalMass()).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void perHypothesisLeavesStrictSubsetsOfTheHypothesisAlone() {
		MassFunction source = MassFunction.builder(ABC).assign("{a}", 0.6).assign("{a,b}", 0.4).build();
		MassFunction d = ContextualDiscounting.discountPerHypothesis(source,
				Collections.singletonMap(Arrays.asList("a", "b"), 0.25));
		assertThat(d.mass("{a}")).isCloseTo(0.6, within(1e-12));
		assertThat(d.mass("{a,b}")).isCloseTo(0.1, within(1e-12));
		assertThat(d.mass("{a,b,c}")).isCloseTo(0.3, within(1e-12));
		assertThatThrownBy(() -> ContextualDiscounting.discountPerHypothesis(source,
				Collections.singletonMap(Arrays.asList("a"), -0.2)))
				.isInstanceOf(InvalidReliabilityException.class);
	}

	@Test
	void invalidPartitionsAreRejected() {
		MassFunction source = MassFunction.vacuous(ABC);
		Map<List<String>, Double> none = Collections.emptyMap();
		assertThatThrownBy(() -> ContextualDiscounting.discountThetaContextual(source,
				Arrays.asList(Arrays.asList("a", "b"), Arrays.asList("b", "c")), none))
				.isInstanceOf(InvalidPartitionException.class);
		assertThatThrownBy(() -> ContextualDiscounting.discountThetaContextual(source,
				Arrays.asList(Arrays.asList("a"), Arrays.asList("b")), none))
				.isInstanceOf(InvalidPartitionException.class);
		assertThatThrownBy(() -> ContextualDiscounting.discountThetaContextual(source,
				Arrays.asList(Arrays.asList("a", "b", "c"), Collections.<String>emptyList()), none))
				.isInstanceOf(InvalidPartitionException.class);
		assertThatThrownBy(() -> ContextualDiscounting.discountThetaContextual(source,
				Arrays.asList(Arrays.asList("a"), Arrays.asList("b", "c")), Collections.singletonMap(Arrays.asList("b"), 0.5)))
				.isInstanceOf(InvalidPartitionException.class);
	}

	@Test
	void invalidRatesAreRejected() {
		assertThatThrownBy(() -> ContextualDiscounting.discountContextual(m(), rates("z", 0.5)))
				.isInstanceOf(MassValidationException.class);
		assertThatThrownBy(() -> ContextualDiscounting.discountContextual(m(), rates("a", 1.2)))
				.isInstanceOf(InvalidReliabilityException.class);
	}
}
