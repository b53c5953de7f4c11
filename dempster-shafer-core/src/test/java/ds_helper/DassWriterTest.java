package ds_helper;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

public class DassWriterTest {

	private static final Frame ABC = Frame.of("a", "b", "c");

	@Test
	void massFunctionUsesBracedSubsetKeys() {
		MassFunction m = MassFunction.builder(ABC).assign("{a,b}", 0.25).assign("{c}", 0.75).build();
		JsonObject json = DassWriter.toJsonTree(m);
		assertThat(json.getAsJsonArray("frame").size()).isEqualTo(3);
		assertThat(json.getAsJsonObject("bba").get("{a,b}").getAsDouble()).isEqualTo(0.25);
		assertThat(DassWriter.toJson(m)).isEqualTo("{\"frame\":[\"a\",\"b\",\"c\"],\"bba\":{\"{c}\":0.75,\"{a,b}\":0.25}}");
	}

	@Test
	void massFunctionSurvivesAWriteAndRead() {
		MassFunction m = MassFunction.builder(ABC).assign("{a}", 0.1).assign("{b,c}", 0.2).assign("{a,b,c}", 0.7).build();
		MassFunction back = DassReader.readMassFunction(DassWriter.toJson(m));
		assertThat(back.frame()).isEqualTo(ABC);
		assertThat(back.approximatelyEquals(m, 1e-15)).isTrue();
	}

	@Test
	void documentSurvivesAWriteAndRead() {
		Map<String, Object> metadata = new LinkedHashMap<String, Object>();
		metadata.put("generator", "writer-test");
		MassFunction s1 = MassFunction.builder(ABC).assign("{a}", 0.6).assign("{a,b,c}", 0.4).build();
		MassFunction s2 = MassFunction.builder(ABC).assign("{b}", 0.3).assign("{a,c}", 0.7).build();
		DassDocument doc = new DassDocument(metadata, ABC, Arrays.asList("first", "second"), Arrays.asList(s1, s2));

		String json = DassWriter.toJson(doc);
		assertThat(json).contains("\"frame_of_discernment\":[\"a\",\"b\",\"c\"]").contains("\"id\":\"first\"");

		DassDocument back = DassReader.read(json);
		assertThat(back.getFrame()).isEqualTo(ABC);
		assertThat(back.getSourceIds()).containsExactly("first", "second");
		assertThat(back.getMetadata()).containsEntry("generator", "writer-test");
		assertThat(back.getSources().get(0).approximatelyEquals(s1, 1e-15)).isTrue();
		assertThat(back.getSources().get(1).approximatelyEquals(s2, 1e-15)).isTrue();
	}

	@Test
	void emptyMetadataIsWrittenAsAnObject() {
		DassDocument doc = new DassDocument(Collections.<String, Object>emptyMap(), ABC,
				Collections.singletonList("only"), Collections.singletonList(MassFunction.vacuous(ABC)));
		assertThat(DassWriter.toJson(doc)).startsWith("{\"metadata\":{},");
	}
}
