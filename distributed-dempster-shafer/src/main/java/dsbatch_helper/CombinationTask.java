package dsbatch_helper;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.apache.spark.api.java.function.Function;

import ds_helper.DassDocument;
import ds_helper.DassReader;
import ds_helper.EvidenceException;
import ds_helper.InvalidReliabilityException;
import ds_helper.MassFunction;
import ds_helper.TotalConflictException;
import ds_impl.ClassicalDiscounting;
import ds_impl.CombinationRules;
import scala.Tuple2;

/*
 * Fuses the sources of one DASS document, given as (path, content) by
 * wholeTextFiles. Every source is discounted with the same reliability
 * first when it is below 1, then the sources are combined in document
 * order. A bad document never fails the job: it comes back as a FAILED
 * or TOTAL_CONFLICT outcome.
 */
public class CombinationTask implements Function<Tuple2<String, String>, CombinationOutcome> {

	private static final long serialVersionUID = 1L;
	private static final Logger LOG = Logger.getLogger(CombinationTask.class);

	private final CombinationRules rule;
	private final double reliability;

	public CombinationTask(CombinationRules rule, double reliability) {
		if (!(reliability >= 0.0 && reliability <= 1.0))
			throw new InvalidReliabilityException("Reliability factor", reliability);
		this.rule = rule;
		this.reliability = reliability;
	}

	@Override
	public CombinationOutcome call(Tuple2<String, String> document) {
		return fuse(document._1, document._2);
	}

	public CombinationOutcome fuse(String path, String json) {
		DassDocument document;
		try {
			document = DassReader.read(json);
		} catch (EvidenceException | IllegalArgumentException e) {
			LOG.warn("Rejected " + path + ": " + e.getMessage());
			return CombinationOutcome.failed(path, rule.ruleName(), e.getMessage());
		}

		List<MassFunction> sources = document.getSources();
		if (reliability < 1.0) {
			List<MassFunction> discounted = new ArrayList<MassFunction>(sources.size());
			for (MassFunction m : sources)
				discounted.add(ClassicalDiscounting.discount(m, reliability));
			sources = discounted;
		}

		try {
			MassFunction fused = rule.combineAll(sources);
			if (LOG.isDebugEnabled())
				LOG.debug(path + " [" + rule.ruleName() + "] " + fused);
			return CombinationOutcome.ok(path, rule.ruleName(), sources.size(), fused);
		} catch (TotalConflictException e) {
			LOG.warn(path + ": total conflict " + e.getConflict() + " under " + rule.ruleName());
			return CombinationOutcome.totalConflict(path, rule.ruleName(), sources.size(), e.getConflict());
		} catch (EvidenceException | IllegalArgumentException e) {
			LOG.warn(path + ": " + rule.ruleName() + " failed: " + e.getMessage());
			return CombinationOutcome.failed(path, rule.ruleName(), e.getMessage());
		}
	}
}
