package simulator.paging;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Reads a plain-text trace, one record per line. Blank lines and text after
 * {@code #} are ignored.
 *
 * <pre>
 * tensor &lt;id&gt; &lt;address&gt; &lt;size&gt; &lt;dataType&gt; &lt;usageCount&gt; &lt;node,node,...|-&gt;
 * node &lt;nodeIndex&gt; &lt;operator&gt; &lt;in,in,...|-&gt; &lt;out,out,...|-&gt;
 * </pre>
 *
 * Addresses and sizes may be decimal or {@code 0x} hex. Plan nodes keep file
 * order.
 */
public final class TraceReader {

	private static final Splitter FIELDS = Splitter.on(' ').trimResults().omitEmptyStrings();
	private static final Splitter IDS = Splitter.on(',').trimResults().omitEmptyStrings();

	private TraceReader() {
	}

	public static Trace read(Path file) throws IOException {
		try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(in, file.toString());
		}
	}

	public static Trace read(Reader reader, String source) throws IOException {
		BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		Map<Integer, Tensor> tensors = new LinkedHashMap<>();
		List<PlanNode> plan = new ArrayList<>();

		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			int hash = line.indexOf('#');
			if (hash >= 0) {
				line = line.substring(0, hash);
			}
			List<String> f = FIELDS.splitToList(line.replace('\t', ' '));
			if (f.isEmpty()) {
				continue;
			}
			try {
				switch (f.get(0)) {
				case "tensor": {
					expect(f, 7, source, lineNumber);
					Tensor t = new Tensor(Integer.parseInt(f.get(1)), parseLong(f.get(2)), parseLong(f.get(3)),
							f.get(4), Integer.parseInt(f.get(5)), ids(f.get(6)));
					if (t.address() < 0 || t.size() <= 0) {
						throw new TraceFormatException(source, lineNumber,
								"tensor " + t.id() + " needs a non-negative address and a positive size");
					}
					if (t.address() > Long.MAX_VALUE - t.size()) {
						throw new TraceFormatException(source, lineNumber,
								"tensor " + t.id() + " runs past the end of the address space");
					}
					if (tensors.put(t.id(), t) != null) {
						throw new TraceFormatException(source, lineNumber, "duplicate tensor " + t.id());
					}
					break;
				}
				case "node": {
					expect(f, 5, source, lineNumber);
					plan.add(new PlanNode(Integer.parseInt(f.get(1)), f.get(2), ids(f.get(3)), ids(f.get(4))));
					break;
				}
				default:
					throw new TraceFormatException(source, lineNumber, "unknown record '" + f.get(0) + "'");
				}
			} catch (NumberFormatException nfe) {
				throw new TraceFormatException(source, lineNumber, "bad number: " + nfe.getMessage());
			}
		}
		return new Trace(tensors, plan);
	}

	private static void expect(List<String> fields, int n, String source, int lineNumber)
			throws TraceFormatException {
		if (fields.size() != n) {
			throw new TraceFormatException(source, lineNumber,
					"'" + fields.get(0) + "' takes " + (n - 1) + " fields, found " + (fields.size() - 1));
		}
	}

	private static long parseLong(String s) {
		if (s.startsWith("0x") || s.startsWith("0X")) {
			return Long.parseLong(s.substring(2), 16);
		}
		return Long.parseLong(s);
	}

	private static List<Integer> ids(String s) {
		if (s.equals("-")) {
			return ImmutableList.of();
		}
		List<Integer> ids = new ArrayList<>();
		for (String id : IDS.split(s)) {
			ids.add(Integer.parseInt(id));
		}
		return ids;
	}
}
