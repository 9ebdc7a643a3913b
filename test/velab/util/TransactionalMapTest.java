package velab.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import velab.InternalCompilerError;

public class TransactionalMapTest {

	private TransactionalMap<String, Integer> map;

	@Before
	public void setup() {
		map = new TransactionalMap<>();
		map.checkpoint();
		map.insert("a", 1);
		map.commit();
	}

	@Test
	public void testCommitKeepsInsertions() {
		map.checkpoint();
		assertTrue(map.insert("b", 2));
		map.commit();
		assertThat(map.size(), is(2));
		assertThat(map.find("b"), is(Optional.of(2)));
		assertFalse(map.isOpen());
	}

	@Test
	public void testUndoRestoresMembership() {
		map.checkpoint();
		map.insert("b", 2);
		map.insert("c", 3);
		List<Map.Entry<String, Integer>> released = map.undo();

		assertThat(map.size(), is(1));
		assertTrue(map.find("a").isPresent());
		assertFalse(map.find("b").isPresent());
		assertThat(released.size(), is(2));
		// most recent first
		assertThat(released.get(0).getKey(), is("c"));
		assertThat(released.get(1).getValue(), is(2));
	}

	@Test
	public void testUndoWithNothingInserted() {
		map.checkpoint();
		assertTrue(map.undo().isEmpty());
		assertThat(map.size(), is(1));
	}

	@Test
	public void testInsertExistingKeyFails() {
		map.checkpoint();
		assertFalse(map.insert("a", 42));
		map.commit();
		assertThat(map.find("a"), is(Optional.of(1)));
	}

	@Test
	public void testUndoDoesNotRemoveCommittedKeyOnDuplicateInsert() {
		map.checkpoint();
		map.insert("a", 42);
		map.undo();
		assertThat(map.find("a"), is(Optional.of(1)));
	}

	@Test(expected = InternalCompilerError.class)
	public void testInsertOutsideTransaction() {
		map.insert("b", 2);
	}

	@Test(expected = InternalCompilerError.class)
	public void testNestedCheckpoint() {
		map.checkpoint();
		map.checkpoint();
	}

	@Test(expected = InternalCompilerError.class)
	public void testCommitWithoutCheckpoint() {
		map.commit();
	}

	@Test
	public void testIterationFollowsInsertionOrder() {
		map.checkpoint();
		map.insert("z", 26);
		map.insert("m", 13);
		map.commit();
		List<String> keys = new ArrayList<>();
		for (Map.Entry<String, Integer> e : map) {
			keys.add(e.getKey());
		}
		assertThat(keys.toString(), is("[a, z, m]"));
	}
}
