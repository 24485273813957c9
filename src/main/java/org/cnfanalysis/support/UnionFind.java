package org.cnfanalysis.support;

import java.util.Arrays;

/**
 * Union-find su nodi 0..n-1 con compressione dei cammini e unione per dimensione.
 * I nodi si aggiungono uno alla volta: la struttura cresce con i nodi osservati.
 */
public final class UnionFind {

    private static final int INITIAL_CAPACITY = 64;

    private int[] parent = new int[INITIAL_CAPACITY];
    private int[] componentSize = new int[INITIAL_CAPACITY];
    private int nodes = 0;
    private int components = 0;

    /**
     * Aggiunge un nuovo nodo isolato.
     *
     * @return identificatore del nodo, pari al numero di nodi precedenti
     */
    public int addNode() {
        if (nodes == parent.length) {
            parent = Arrays.copyOf(parent, parent.length * 2);
            componentSize = Arrays.copyOf(componentSize, componentSize.length * 2);
        }
        parent[nodes] = nodes;
        componentSize[nodes] = 1;
        components++;
        return nodes++;
    }

    public int find(int node) {
        checkNode(node);
        int root = node;
        while (parent[root] != root) {
            root = parent[root];
        }
        // Compressione: ogni nodo del cammino punta direttamente alla radice
        while (parent[node] != root) {
            int next = parent[node];
            parent[node] = root;
            node = next;
        }
        return root;
    }

    /**
     * Unisce le componenti dei due nodi.
     *
     * @return true se i nodi appartenevano a componenti distinte
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (componentSize[rootA] < componentSize[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        componentSize[rootA] += componentSize[rootB];
        components--;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int nodeCount() {
        return nodes;
    }

    public int componentCount() {
        return components;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodes) {
            throw new IndexOutOfBoundsException("Nodo " + node + " inesistente (nodi: " + nodes + ")");
        }
    }
}
