package velab.util;

import velab.InternalCompilerError;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An insertion-ordered map whose insertions are grouped into transactions.
 *
 * Every insertion must happen between a {@link #checkpoint()} and either a {@link #commit()} or an
 * {@link #undo()}. Transactions do not nest. Undoing a transaction removes everything inserted since the
 * checkpoint and hands the removed entries back to the caller, who becomes responsible for disposing of them.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class TransactionalMap<K, V> implements Iterable<Map.Entry<K, V>> {
	private final Map<K, V> entries;
	private List<K> inserted;

	public TransactionalMap() {
		this.entries = new LinkedHashMap<>();
		this.inserted = null;
	}

	public void checkpoint() {
		if (inserted != null) {
			throw new InternalCompilerError("checkpoint while a transaction is already open");
		}
		inserted = new ArrayList<>();
	}

	/**
	 * Inserts a new entry into the open transaction. Ownership of the value only passes to this map when the
	 * method returns true; an existing key is never replaced.
	 */
	public boolean insert(K key, V value) {
		requireOpen("insert");
		if (entries.containsKey(key)) {
			return false;
		}
		entries.put(key, value);
		inserted.add(key);
		return true;
	}

	public void commit() {
		requireOpen("commit");
		inserted = null;
	}

	/**
	 * Restores membership to the last checkpoint.
	 *
	 * @return the entries removed by the rollback, most recent first
	 */
	public List<Map.Entry<K, V>> undo() {
		requireOpen("undo");
		List<Map.Entry<K, V>> released = new ArrayList<>();
		for (int i = inserted.size() - 1; i >= 0; --i) {
			K key = inserted.get(i);
			released.add(new AbstractMap.SimpleImmutableEntry<>(key, entries.remove(key)));
		}
		inserted = null;
		return released;
	}

	public boolean isOpen() {
		return inserted != null;
	}

	public Optional<V> find(K key) {
		return Optional.ofNullable(entries.get(key));
	}

	public int size() {
		return entries.size();
	}

	@Override
	public Iterator<Map.Entry<K, V>> iterator() {
		return Collections.unmodifiableMap(entries).entrySet().iterator();
	}

	private void requireOpen(String operation) {
		if (inserted == null) {
			throw new InternalCompilerError(operation + " outside of a transaction");
		}
	}
}
