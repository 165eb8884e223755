package gll.parser.gss;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.engine.*;
import guru.nidi.graphviz.model.*;

import static guru.nidi.graphviz.model.Factory.*;

/**
 * Exports graph structured stacks as graphviz graphs, edges point from callees to callers and
 * are labeled with the return slot.
 */
public class GssDotExporter {

	private GssDotExporter(){
	}

	public static Graph toGraph(String name, GraphStructuredStack stack){
		Map<GssNode, MutableNode> nodes = new LinkedHashMap<>();
		for (GssNode node : stack.getNodes()){
			nodes.put(node, mutNode("g" + nodes.size()).add(Label.of(node.label()), Shape.ELLIPSE));
		}
		for (Map.Entry<GssNode, MutableNode> entry : nodes.entrySet()){
			for (GssEdge edge : stack.edgesOf(entry.getKey())){
				entry.getValue().addLink(to(nodes.get(edge.target)).with(Label.of(edge.returnSlot.formatItem())));
			}
		}
		return graph(name).directed().nodeAttr().with(Font.name("Helvetica"))
				.with(nodes.values().toArray(new MutableNode[0]));
	}

	public static String toDot(String name, GraphStructuredStack stack){
		return toGraph(name, stack).toString();
	}

	public static void writeSvg(String name, GraphStructuredStack stack, File file) throws IOException {
		Graphviz.fromGraph(toGraph(name, stack)).engine(Engine.DOT).render(Format.SVG_STANDALONE).toFile(file);
	}
}
