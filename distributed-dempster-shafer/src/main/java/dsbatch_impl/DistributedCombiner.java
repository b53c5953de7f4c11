package dsbatch_impl;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;

import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;
import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.api.java.function.Function;
import org.apache.spark.api.java.function.VoidFunction;
import org.apache.spark.util.LongAccumulator;

import com.google.gson.JsonObject;

import ds_impl.CombinationRules;
import dsbatch_helper.CombinationOutcome;
import dsbatch_helper.CombinationTask;

/*
 * Batch fusion over a directory of DASS documents.
 * Each document is one record of wholeTextFiles and is fused independently
 * by a CombinationTask. Outcomes are written as JSON lines under outputPath,
 * and a _summary.json with the per-status counts is written next to them.
 */
public class DistributedCombiner implements Serializable {

	private static final long serialVersionUID = 1L;
	private static final Logger LOG = Logger.getLogger(DistributedCombiner.class);

	public static String datasetFile = null;
	public static String outputPath = null;
	public static String ruleName = "dempster";
	public static int numPartitions = 1;
	public static double reliability = 1.0;
	public static JavaSparkContext sc;

	public static long okCount = 0;
	public static long conflictCount = 0;
	public static long failedCount = 0;

	public static void execute() throws IOException {
		CombinationRules rule = CombinationRules.forName(ruleName);
		CombinationTask task = new CombinationTask(rule, reliability);
		LOG.info("Fusing " + datasetFile + " with " + rule.ruleName() + ", reliability " + reliability);

		JavaPairRDD<String, String> documents = sc.wholeTextFiles(datasetFile, numPartitions);
		JavaRDD<CombinationOutcome> outcomes = documents.map(task);
		outcomes.cache();

		final LongAccumulator ok = sc.sc().longAccumulator("ok");
		final LongAccumulator conflict = sc.sc().longAccumulator("total_conflict");
		final LongAccumulator failed = sc.sc().longAccumulator("failed");
		outcomes.foreach(new VoidFunction<CombinationOutcome>() {
			private static final long serialVersionUID = 1L;

			@Override
			public void call(CombinationOutcome o) {
				switch (o.getStatus()) {
				case OK:
					ok.add(1);
					break;
				case TOTAL_CONFLICT:
					conflict.add(1);
					break;
				default:
					failed.add(1);
				}
			}
		});
		okCount = ok.value();
		conflictCount = conflict.value();
		failedCount = failed.value();

		outcomes.map(new Function<CombinationOutcome, String>() {
			private static final long serialVersionUID = 1L;

			@Override
			public String call(CombinationOutcome o) {
				return o.toJson();
			}
		}).saveAsTextFile(outputPath);
		outcomes.unpersist();

		LOG.info("Fused documents: " + okCount + " ok, " + conflictCount + " in total conflict, " + failedCount + " failed");
		writeSummary(rule);
	}

	public static void writeSummary(CombinationRules rule) throws IOException {
		JsonObject summary = new JsonObject();
		summary.addProperty("dataset", datasetFile);
		summary.addProperty("rule", rule.ruleName());
		summary.addProperty("reliability", reliability);
		summary.addProperty("ok", okCount);
		summary.addProperty("total_conflict", conflictCount);
		summary.addProperty("failed", failedCount);

		FileSystem fs = FileSystem.get(sc.hadoopConfiguration());
		Path path = new Path(outputPath, "_summary.json");
		FSDataOutputStream out = fs.create(path, true);
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
		try {
			bw.write(summary.toString());
			bw.write("\n");
		} finally {
			bw.close();
		}
	}
}
