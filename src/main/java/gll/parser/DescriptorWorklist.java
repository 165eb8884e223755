package gll.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pending descriptors, one level per input position.
 *
 * Each level has a FIFO queue and the set of descriptors ever added to it, a descriptor is
 * only queued once. Levels are drained in the order of their positions, descriptors can only
 * be added to the current or a later level.
 */
class DescriptorWorklist {

	private static class Level {
		final ArrayDeque<Descriptor> queue = new ArrayDeque<>();
		final Set<Descriptor> added = new HashSet<>();
	}

	private final List<Level> levels;

	private int currentLevel = 0;

	private int addedCount = 0;

	private int processedCount = 0;

	/**
	 * Maximum number of added descriptors, 0 for no limit
	 */
	private final int maxDescriptors;

	/**
	 * @param inputSize number of tokens, there are inputSize + 1 levels
	 */
	DescriptorWorklist(int inputSize, int maxDescriptors) {
		this.levels = new ArrayList<>(inputSize + 1);
		for (int i = 0; i <= inputSize; i++){
			levels.add(new Level());
		}
		this.maxDescriptors = maxDescriptors;
	}

	/**
	 * Queues the descriptor if it has not been added before
	 *
	 * @return true if the descriptor is new
	 * @throws IllegalStateException if the level of the descriptor has already been drained
	 */
	boolean add(Descriptor descriptor){
		if (descriptor.position < currentLevel){
			throw new IllegalStateException(String.format("Descriptor %s added to the already processed level %d (current level %d)",
					descriptor, descriptor.position, currentLevel));
		}
		Level level = levels.get(descriptor.position);
		if (!level.added.add(descriptor)){
			return false;
		}
		if (maxDescriptors > 0 && addedCount >= maxDescriptors){
			throw new ResourceExhaustion("maxDescriptors", maxDescriptors);
		}
		level.queue.add(descriptor);
		addedCount++;
		return true;
	}

	boolean hasNext(){
		while (currentLevel < levels.size()){
			if (!levels.get(currentLevel).queue.isEmpty()){
				return true;
			}
			if (currentLevel == levels.size() - 1){
				return false;
			}
			currentLevel++;
		}
		return false;
	}

	/**
	 * Next descriptor of the lowest level with pending descriptors
	 */
	Descriptor next(){
		if (!hasNext()){
			throw new IllegalStateException("No pending descriptors");
		}
		processedCount++;
		return levels.get(currentLevel).queue.poll();
	}

	/**
	 * Position of the level that is currently drained
	 */
	int currentLevel(){
		return currentLevel;
	}

	int addedCount(){
		return addedCount;
	}

	int processedCount(){
		return processedCount;
	}
}
