import java.io.IOException;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;

import dsbatch_impl.DistributedCombiner;

public class DempsterShaferMain
{
	public static void main( String[] args ) throws IOException
	{
		if (args.length < 3) {
			System.err.println("Usage: DempsterShaferMain <datasetPath> <outputPath> <rule> [numPartitions] [reliability]");
			System.exit(1);
		}
		SparkConf sparkConf = new SparkConf().setAppName("DistributedDempsterShafer");
		sparkConf.set("spark.serializer", "org.apache.spark.serializer.KryoSerializer");

		DistributedCombiner.sc = new JavaSparkContext(sparkConf);
		Logger rootLogger = Logger.getRootLogger();
		rootLogger.setLevel(Level.ERROR);
		System.out.println("dataset: " + args[0]);
		System.out.println("output: " + args[1]);
		System.out.println("rule: " + args[2]);
		DistributedCombiner.datasetFile = args[0];
		DistributedCombiner.outputPath = args[1];
		DistributedCombiner.ruleName = args[2];
		if (args.length > 3)
			DistributedCombiner.numPartitions = Integer.parseInt(args[3]);
		if (args.length > 4)
			DistributedCombiner.reliability = Double.parseDouble(args[4]);
		System.out.println("numPartition: " + DistributedCombiner.numPartitions);
		System.out.println("reliability: " + DistributedCombiner.reliability);

		Long start = System.currentTimeMillis();
		DistributedCombiner.execute();
		Long end = System.currentTimeMillis();
		System.out.println(" ==== Total: " + (end - start)/1000 + " sec");
		System.out.println(" ==== ok: " + DistributedCombiner.okCount + ", total conflict: " + DistributedCombiner.conflictCount
				+ ", failed: " + DistributedCombiner.failedCount);
		DistributedCombiner.sc.stop();
	}
}
