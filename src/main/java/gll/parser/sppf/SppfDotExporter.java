package gll.parser.sppf;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.engine.*;
import guru.nidi.graphviz.model.*;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Exports forests as graphviz graphs.
 *
 * Symbol nodes are drawn as rounded boxes, intermediate nodes as boxes, packed nodes as
 * small circles and terminals as plain text. Ambiguous nodes are red.
 */
public class SppfDotExporter {

	private SppfDotExporter(){
	}

	public static Graph toGraph(String name, SppfNode root){
		Map<SppfNode, MutableNode> nodes = new LinkedHashMap<>();
		for (SppfNode node : Forests.collectNodes(root)){
			MutableNode dotNode = mutNode("n" + nodes.size());
			dotNode.add(attributes(node));
			dotNode.add(attr("fontname", "Helvetica"));
			nodes.put(node, dotNode);
		}
		for (Map.Entry<SppfNode, MutableNode> entry : nodes.entrySet()){
			for (SppfNode child : entry.getKey().children()){
				entry.getValue().addLink(nodes.get(child));
			}
		}
		return graph(name).directed().nodeAttr().with(Font.name("Helvetica")).with(nodes.values().toArray(new MutableNode[0]));
	}

	private static Attributes[] attributes(SppfNode node){
		switch (node.kind()){
			case SYMBOL:
				BranchNode symbol = (BranchNode)node;
				if (symbol.isAmbiguous()){
					return new Attributes[]{Label.of(node.label()), Shape.RECTANGLE, Style.ROUNDED, Color.RED, Color.RED.font()};
				}
				return new Attributes[]{Label.of(node.label()), Shape.RECTANGLE, Style.ROUNDED};
			case INTERMEDIATE:
				if (((BranchNode)node).isAmbiguous()){
					return new Attributes[]{Label.of(node.label()), Shape.RECTANGLE, Color.RED, Color.RED.font()};
				}
				return new Attributes[]{Label.of(node.label()), Shape.RECTANGLE};
			case PACKED:
				return new Attributes[]{Label.of(""), Shape.CIRCLE, attr("width", "0.15")};
			default:
				return new Attributes[]{Label.of(node.label()), attr("shape", "plaintext")};
		}
	}

	/**
	 * Graph in the dot language
	 */
	public static String toDot(String name, SppfNode root){
		return toGraph(name, root).toString();
	}

	public static void writeSvg(String name, SppfNode root, File file) throws IOException {
		Graphviz.fromGraph(toGraph(name, root)).engine(Engine.DOT).render(Format.SVG_STANDALONE).toFile(file);
	}
}
