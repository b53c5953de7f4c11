package ds_impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import ds_helper.MassFunction;

/**
 * Every combination rule of the engine, addressable by name.
 * <br/>
 * {@link #combineAll(List)} folds the binary rule from left to right over the sources in the order
 * given. PCR5, PCR6, cautious and bold are not associative, so that order is part of the result.
 * PCR6 is the exception: it combines all sources at once.
 */
public enum CombinationRules implements CombinationRule {

	DEMPSTER("dempster") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return BasicCombination.combineConjunctive(m1, m2, true);
		}
	},
	CONJUNCTIVE("conjunctive") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return BasicCombination.combineConjunctive(m1, m2, false);
		}
	},
	DISJUNCTIVE("disjunctive") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return BasicCombination.combineDisjunctive(m1, m2);
		}
	},
	YAGER("yager") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return AdvancedCombination.combineYager(m1, m2);
		}
	},
	DUBOIS_PRADE("dubois-prade") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return AdvancedCombination.combineDuboisPrade(m1, m2);
		}
	},
	ZHANG("zhang") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return AdvancedCombination.combineZhang(m1, m2);
		}
	},
	PCR5("pcr5") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return PcrCombination.combinePcr5(m1, m2);
		}
	},
	PCR6("pcr6") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return PcrCombination.combinePcr5(m1, m2);
		}

		@Override
		public MassFunction combineAll(List<MassFunction> sources) {
			return PcrCombination.combinePcr6(sources);
		}
	},
	CAUTIOUS("cautious") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return CautiousCombination.combineCautious(m1, m2);
		}
	},
	BOLD("bold") {
		@Override
		public MassFunction combine(MassFunction m1, MassFunction m2) {
			return CautiousCombination.combineBold(m1, m2);
		}
	};

	private final String ruleName;

	CombinationRules(String ruleName) {
		this.ruleName = ruleName;
	}

	public String ruleName() {
		return ruleName;
	}

	public MassFunction combineAll(List<MassFunction> sources) {
		return BasicCombination.combineMultiple(sources, this);
	}

	/**
	 * Looks a rule up by name, ignoring case and accepting '_' for '-'.
	 */
	public static CombinationRules forName(String name) {
		String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		List<String> known = new ArrayList<String>();
		for (CombinationRules rule : values()) {
			if (rule.ruleName.equals(key))
				return rule;
			known.add(rule.ruleName);
		}
		throw new IllegalArgumentException("Unknown combination rule '" + name + "', expected one of " + known);
	}
}
