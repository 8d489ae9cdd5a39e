package nl.bytesoflife.fol.language.parser;

import java.util.List;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value) implements SNode {
        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /**
         * The leading atom of the list, or "" when the list is empty or starts with a list.
         */
        public String tag() {
            if (children.isEmpty()) return "";
            return children.get(0) instanceof SAtom atom ? atom.value() : "";
        }

        /**
         * The atom at the given index, or null when absent or not an atom.
         */
        public String atom(int index) {
            if (index >= children.size()) return null;
            return children.get(index) instanceof SAtom atom ? atom.value() : null;
        }

        public int size() {
            return children.size();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
