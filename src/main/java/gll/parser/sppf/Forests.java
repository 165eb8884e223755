package gll.parser.sppf;

import java.math.BigInteger;
import java.util.*;

/**
 * Utility methods for walking forests.
 */
public class Forests {

	private Forests(){
	}

	/**
	 * All nodes reachable from the passed node, in depth first pre order
	 */
	public static Set<SppfNode> collectNodes(SppfNode root){
		Set<SppfNode> visited = new LinkedHashSet<>();
		Deque<SppfNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()){
			SppfNode node = stack.pop();
			if (!visited.add(node)){
				continue;
			}
			List<? extends SppfNode> children = node.children();
			for (int i = children.size() - 1; i >= 0; i--){
				if (!visited.contains(children.get(i))){
					stack.push(children.get(i));
				}
			}
		}
		return visited;
	}

	/**
	 * Symbol and intermediate nodes with more than one packed child
	 */
	public static List<BranchNode> ambiguousNodes(SppfNode root){
		List<BranchNode> ret = new ArrayList<>();
		for (SppfNode node : collectNodes(root)){
			if (node instanceof BranchNode && ((BranchNode) node).isAmbiguous()){
				ret.add((BranchNode)node);
			}
		}
		return ret;
	}

	public static boolean isAmbiguous(SppfNode root){
		return !ambiguousNodes(root).isEmpty();
	}

	/**
	 * Does the forest contain a cycle? Cycles come from derivations like A ⇒+ A and
	 * represent infinitely many trees.
	 */
	public static boolean isCyclic(SppfNode root){
		return findCycleNode(root) != null;
	}

	/**
	 * A node on a cycle or null if the forest is acyclic
	 */
	private static SppfNode findCycleNode(SppfNode root){
		Set<SppfNode> finished = new HashSet<>();
		Set<SppfNode> onPath = new HashSet<>();
		Deque<Iterator<? extends SppfNode>> iterators = new ArrayDeque<>();
		Deque<SppfNode> path = new ArrayDeque<>();
		path.push(root);
		onPath.add(root);
		iterators.push(root.children().iterator());
		while (!path.isEmpty()){
			Iterator<? extends SppfNode> iterator = iterators.peek();
			if (iterator.hasNext()){
				SppfNode child = iterator.next();
				if (onPath.contains(child)){
					return child;
				}
				if (!finished.contains(child)){
					path.push(child);
					onPath.add(child);
					iterators.push(child.children().iterator());
				}
			} else {
				SppfNode node = path.pop();
				iterators.pop();
				onPath.remove(node);
				finished.add(node);
			}
		}
		return null;
	}

	/**
	 * Nodes that lie on a cycle, computed as the nodes of the non trivial strongly connected
	 * components (Tarjan's algorithm)
	 */
	public static Set<SppfNode> cyclicNodes(SppfNode root){
		Map<SppfNode, Integer> index = new HashMap<>();
		Map<SppfNode, Integer> lowLink = new HashMap<>();
		Deque<SppfNode> componentStack = new ArrayDeque<>();
		Set<SppfNode> onStack = new HashSet<>();
		Set<SppfNode> cyclic = new LinkedHashSet<>();
		Deque<SppfNode> path = new ArrayDeque<>();
		Deque<Iterator<? extends SppfNode>> iterators = new ArrayDeque<>();
		index.put(root, 0);
		lowLink.put(root, 0);
		componentStack.push(root);
		onStack.add(root);
		path.push(root);
		iterators.push(root.children().iterator());
		while (!path.isEmpty()){
			SppfNode node = path.peek();
			Iterator<? extends SppfNode> iterator = iterators.peek();
			if (iterator.hasNext()){
				SppfNode child = iterator.next();
				if (!index.containsKey(child)){
					index.put(child, index.size());
					lowLink.put(child, index.get(child));
					componentStack.push(child);
					onStack.add(child);
					path.push(child);
					iterators.push(child.children().iterator());
				} else if (onStack.contains(child)){
					lowLink.put(node, Math.min(lowLink.get(node), index.get(child)));
				}
				continue;
			}
			path.pop();
			iterators.pop();
			if (!path.isEmpty()){
				SppfNode parent = path.peek();
				lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
			}
			if (lowLink.get(node).equals(index.get(node))){
				List<SppfNode> component = new ArrayList<>();
				SppfNode member;
				do {
					member = componentStack.pop();
					onStack.remove(member);
					component.add(member);
				} while (member != node);
				if (component.size() > 1 || node.children().contains(node)){
					cyclic.addAll(component);
				}
			}
		}
		return cyclic;
	}

	/**
	 * Number of distinct derivation trees represented by the forest
	 *
	 * @throws IllegalArgumentException if the forest is cyclic and therefore represents infinitely many trees
	 */
	public static BigInteger countDerivations(SppfNode root){
		SppfNode cycleNode = findCycleNode(root);
		if (cycleNode != null){
			throw new IllegalArgumentException(String.format("Forest is cyclic at %s, it contains infinitely many derivations", cycleNode));
		}
		Map<SppfNode, BigInteger> counts = new HashMap<>();
		// children before parents
		for (SppfNode node : postOrder(root)){
			BigInteger count;
			if (node instanceof BranchNode){
				count = BigInteger.ZERO;
				for (PackedNode packedNode : ((BranchNode) node).getPackedNodes()){
					count = count.add(counts.get(packedNode));
				}
			} else if (node instanceof PackedNode){
				count = BigInteger.ONE;
				for (SppfNode child : node.children()){
					count = count.multiply(counts.get(child));
				}
			} else {
				count = BigInteger.ONE;
			}
			counts.put(node, count);
		}
		return counts.get(root);
	}

	private static List<SppfNode> postOrder(SppfNode root){
		List<SppfNode> order = new ArrayList<>();
		Set<SppfNode> visited = new HashSet<>();
		Deque<Iterator<? extends SppfNode>> iterators = new ArrayDeque<>();
		Deque<SppfNode> path = new ArrayDeque<>();
		path.push(root);
		visited.add(root);
		iterators.push(root.children().iterator());
		while (!path.isEmpty()){
			Iterator<? extends SppfNode> iterator = iterators.peek();
			if (iterator.hasNext()){
				SppfNode child = iterator.next();
				if (visited.add(child)){
					path.push(child);
					iterators.push(child.children().iterator());
				}
			} else {
				order.add(path.pop());
				iterators.pop();
			}
		}
		return order;
	}
}
