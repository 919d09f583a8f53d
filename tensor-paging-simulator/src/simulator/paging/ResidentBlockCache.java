package simulator.paging;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The bounded set of resident blocks in recency order. A hash index on the
 * start address finds a block; an intrusive doubly-linked list threaded through
 * the blocks keeps the order, MRU at the head and LRU at the tail. Every
 * operation is O(1) except {@link #snapshot()}.
 */
public final class ResidentBlockCache {

	private final long capacity;
	private final Map<Long, Block> index = new HashMap<>();

	private Block mru = null;
	private Block lru = null;
	private long residentBytes = 0;

	ResidentBlockCache(long capacity) {
		assert capacity > 0;
		this.capacity = capacity;
	}

	public long capacity() {
		return capacity;
	}

	public int size() {
		return index.size();
	}

	public boolean isFull() {
		return index.size() >= capacity;
	}

	public long residentBytes() {
		return residentBytes;
	}

	public boolean contains(long startAddress) {
		return index.containsKey(startAddress);
	}

	/** @return the resident block, or null on a miss */
	Block get(long startAddress) {
		return index.get(startAddress);
	}

	/** Move a resident block to the MRU end. */
	void touch(Block b) {
		assert index.get(b.startAddress()) == b;
		if (b == mru) {
			return;
		}
		unlink(b);
		linkAsMru(b);
	}

	/** Insert a block that is not resident. The caller must make room first. */
	void insert(Block b) {
		assert !index.containsKey(b.startAddress()) : "Duplicate resident block " + b;
		assert !isFull() : "Insert into a full cache";
		index.put(b.startAddress(), b);
		linkAsMru(b);
		residentBytes += b.size();
	}

	/** @return the least-recently-used block, or null if nothing is resident */
	Block lruBlock() {
		return lru;
	}

	/** Remove and return the least-recently-used block, or null if empty. */
	Block evictLru() {
		Block victim = lru;
		if (victim == null) {
			return null;
		}
		unlink(victim);
		index.remove(victim.startAddress());
		residentBytes -= victim.size();
		return victim;
	}

	void clear() {
		for (Block b = mru; b != null;) {
			Block next = b.lessRecent;
			b.moreRecent = null;
			b.lessRecent = null;
			b = next;
		}
		index.clear();
		mru = null;
		lru = null;
		residentBytes = 0;
	}

	private void linkAsMru(Block b) {
		b.moreRecent = null;
		b.lessRecent = mru;
		if (mru != null) {
			mru.moreRecent = b;
		}
		mru = b;
		if (lru == null) {
			lru = b;
		}
	}

	private void unlink(Block b) {
		if (b.moreRecent != null) {
			b.moreRecent.lessRecent = b.lessRecent;
		} else {
			mru = b.lessRecent;
		}
		if (b.lessRecent != null) {
			b.lessRecent.moreRecent = b.moreRecent;
		} else {
			lru = b.moreRecent;
		}
		b.moreRecent = null;
		b.lessRecent = null;
	}

	/** Resident blocks ordered from most to least recently used. */
	public List<Block> snapshot() {
		List<Block> blocks = new ArrayList<>(index.size());
		for (Block b = mru; b != null; b = b.lessRecent) {
			blocks.add(b);
		}
		return blocks;
	}

	/** Expensive consistency check of the list against the index. */
	boolean verify() {
		assert index.size() <= capacity : "Resident blocks " + index.size() + " exceed capacity " + capacity;
		long bytes = 0;
		int count = 0;
		Block prev = null;
		for (Block b = mru; b != null; b = b.lessRecent) {
			assert b.moreRecent == prev : "Broken LRU link at " + b;
			assert index.get(b.startAddress()) == b : "Unindexed resident block " + b;
			bytes += b.size();
			count++;
			prev = b;
		}
		assert prev == lru : "LRU tail mismatch";
		assert count == index.size() : "LRU list holds " + count + " blocks, index holds " + index.size();
		assert bytes == residentBytes : "Resident bytes " + residentBytes + " but blocks sum to " + bytes;
		return true;
	}
}
