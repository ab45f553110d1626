package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.DictLiteral;
import me.christianrobert.pystyle.transformer.ast.ListLiteral;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering list and dict literals as explicit construction plus population.
 *
 * <h3>Assigned to a name or field:</h3>
 * <pre>
 * xs = [1, 2]   -&gt;   List&lt;Integer&gt; xs = new ArrayList&lt;&gt;();
 *                    xs.add(1);
 *                    xs.add(2);
 * </pre>
 *
 * <h3>Anywhere else, through a hoisted temporary:</h3>
 * <pre>
 * print([1, 2]) -&gt;   List&lt;Integer&gt; _list0 = new ArrayList&lt;&gt;();
 *                    _list0.add(1);
 *                    _list0.add(2);
 *                    System.out.println(_list0);
 * </pre>
 *
 * <p>Empty literals render inline as the bare constructor.</p>
 */
public class VisitCollectionLiteral {

    private static final String ARRAY_LIST = "java.util.ArrayList";
    private static final String HASH_MAP = "java.util.HashMap";

    public static String list(ListLiteral node, JavaStyleCodeBuilder b) {
        String target = b.takePopulationTarget(node);
        b.addImport(ARRAY_LIST);
        String construction = "new ArrayList<>()";
        if (node.isEmpty()) {
            return construction;
        }

        List<String> elements = new ArrayList<>();
        for (SyntaxNode element : node.getElements()) {
            elements.add(b.visit(element));
        }

        String collection = target != null ? target : b.newTemp("_list");
        List<String> population = new ArrayList<>();
        for (String element : elements) {
            population.add(collection + ".add(" + element + ");");
        }
        return populate(node, target, collection, construction, population, b);
    }

    public static String dict(DictLiteral node, JavaStyleCodeBuilder b) {
        String target = b.takePopulationTarget(node);
        b.addImport(HASH_MAP);
        String construction = "new HashMap<>()";
        if (node.isEmpty()) {
            return construction;
        }

        List<String> keys = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (int i = 0; i < node.getKeys().size(); i++) {
            keys.add(b.visit(node.getKeys().get(i)));
            values.add(b.visit(node.getValues().get(i)));
        }

        String collection = target != null ? target : b.newTemp("_map");
        List<String> population = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            population.add(collection + ".put(" + keys.get(i) + ", " + values.get(i) + ");");
        }
        return populate(node, target, collection, construction, population, b);
    }

    /**
     * Emits the population lines after the assignment when there is a target, else hoists a
     * temporary with its population before the statement.
     *
     * @return the expression that replaces the literal
     */
    static String populate(SyntaxNode node, String target, String collection, String construction,
                           List<String> population, JavaStyleCodeBuilder b) {
        if (target != null) {
            b.appendAfterStatement(population);
            return construction;
        }
        List<String> lines = new ArrayList<>();
        lines.add(b.javaType(b.typeOf(node)) + " " + collection + " = " + construction + ";");
        lines.addAll(population);
        b.hoist(lines);
        return collection;
    }
}
