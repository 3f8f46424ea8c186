package DFAMin.Registry;

import DFAMin.Model.StateId;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Disjoint-set (union-find) partition of a fixed set of states, with path compression.
 * States are addressed by a dense index; the parent structure is a plain int array.
 */
public class DisjointSetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<StateId> key2Index;
    private final List<StateId> elements;
    private final int[] parent;
    private int classCount;

    public DisjointSetRegistry(Collection<? extends StateId> states) {
        this.key2Index = new Object2IntOpenHashMap<>(states.size());
        this.key2Index.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.elements = new ArrayList<>(states.size());
        for (StateId s : states) {
            if (key2Index.getInt(s) == MISSING_ELEMENT) {
                key2Index.put(s, elements.size());
                elements.add(s);
            }
        }
        this.parent = new int[elements.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        this.classCount = elements.size();
    }

    /**
     * @return dense index of the state, or MISSING_ELEMENT if the registry does not hold it
     */
    public int indexOf(StateId state) {
        return key2Index.getInt(state);
    }

    /**
     * Representative of the class containing the state.
     */
    public StateId find(StateId state) {
        return elements.get(findIndex(requireIndex(state)));
    }

    public boolean sameClass(StateId p, StateId q) {
        return findIndex(requireIndex(p)) == findIndex(requireIndex(q));
    }

    /**
     * Merge the classes of two states.
     * @return true if they were in different classes
     */
    public boolean unify(StateId p, StateId q) {
        int root1 = findIndex(requireIndex(p));
        int root2 = findIndex(requireIndex(q));
        if (root1 == root2) {
            return false;
        }
        parent[root1] = root2;
        classCount--;
        return true;
    }

    int findIndex(int index) {
        int root = index;
        while (parent[root] != root) {
            root = parent[root];
        }
        // compress: point every visited element straight at the root
        while (parent[index] != root) {
            int next = parent[index];
            parent[index] = root;
            index = next;
        }
        return root;
    }

    public int size() {
        return elements.size();
    }

    public int getClassCount() {
        return classCount;
    }

    /**
     * Current classes, each sorted, ordered by their smallest member.
     */
    public List<SortedSet<StateId>> classes() {
        final Int2ObjectMap<SortedSet<StateId>> byRoot = new Int2ObjectOpenHashMap<>(classCount);
        for (int i = 0; i < elements.size(); i++) {
            final int root = findIndex(i);
            SortedSet<StateId> members = byRoot.get(root);
            if (members == null) {
                members = new TreeSet<>();
                byRoot.put(root, members);
            }
            members.add(elements.get(i));
        }
        final List<SortedSet<StateId>> result = new ArrayList<>(byRoot.values());
        result.sort((a, b) -> a.first().compareTo(b.first()));
        return result;
    }

    private int requireIndex(StateId state) {
        int index = key2Index.getInt(state);
        if (index == MISSING_ELEMENT) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return index;
    }
}
