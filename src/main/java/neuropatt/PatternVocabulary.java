package neuropatt;

import java.io.Serializable;
import java.util.List;

/**
 * Pattern type labels in their canonical order, plus the names of the columns
 * of a pattern result row.
 */
public final class PatternVocabulary implements Serializable {

	private static final long serialVersionUID = 1L;

	private final List<String> types;
	private final List<String> columnNames;

	public PatternVocabulary(List<String> types, List<String> columnNames) {
		this.types = List.copyOf(types);
		this.columnNames = List.copyOf(columnNames);
	}

	public List<String> getTypes() {
		return this.types;
	}

	public List<String> getColumnNames() {
		return this.columnNames;
	}

	public int size() {
		return this.types.size();
	}

	public int indexOf(String type) {
		return this.types.indexOf(type);
	}

	/**
	 * @return e.g. {@code "1.planeWave 2.synchronous "}
	 */
	public String legend() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < types.size(); i++) {
			sb.append(i + 1).append('.').append(types.get(i)).append(' ');
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof PatternVocabulary)) return false;
		PatternVocabulary other = (PatternVocabulary) obj;
		return types.equals(other.types) && columnNames.equals(other.columnNames);
	}

	@Override
	public int hashCode() {
		return types.hashCode() * 31 + columnNames.hashCode();
	}

	@Override
	public String toString() {
		return types.toString();
	}
}
