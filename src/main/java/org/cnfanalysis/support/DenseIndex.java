package org.cnfanalysis.support;

import java.util.Arrays;

/**
 * INDICE DENSO - Rimappatura di identificatori interi sparsi su posizioni contigue
 *
 * Associa a ogni chiave non nulla (variabile o letterale) una posizione 0, 1, 2, ...
 * nell'ordine di prima osservazione. Le strutture indicizzate per variabile crescono
 * così con il numero di chiavi distinte e non con il valore massimo della chiave:
 * una sola variabile di indice 2.000.000.000 occupa una posizione, non due miliardi.
 *
 * Tabella hash ad indirizzamento aperto con scansione lineare su array primitivi;
 * la chiave 0 marca le celle libere.
 */
public final class DenseIndex {

    private static final int EMPTY = 0;
    private static final int INITIAL_CAPACITY = 64;

    private int[] keys = new int[INITIAL_CAPACITY];
    private int[] slots = new int[INITIAL_CAPACITY];
    private int[] keyBySlot = new int[INITIAL_CAPACITY / 2];
    private int size = 0;

    /**
     * Restituisce la posizione della chiave, assegnandone una nuova alla prima osservazione.
     *
     * @param key identificatore non nullo
     * @return posizione densa in [0, size)
     */
    public int slotOf(int key) {
        if (key == EMPTY) {
            throw new IllegalArgumentException("La chiave 0 non è indicizzabile");
        }

        int mask = keys.length - 1;
        int cell = mix(key) & mask;
        while (keys[cell] != EMPTY) {
            if (keys[cell] == key) {
                return slots[cell];
            }
            cell = (cell + 1) & mask;
        }

        keys[cell] = key;
        slots[cell] = size;
        if (size == keyBySlot.length) {
            keyBySlot = Arrays.copyOf(keyBySlot, keyBySlot.length * 2);
        }
        keyBySlot[size] = key;
        size++;

        if (size * 2 > keys.length) {
            rehash();
        }
        return size - 1;
    }

    /**
     * @return posizione della chiave, -1 se mai osservata
     */
    public int find(int key) {
        if (key == EMPTY) {
            return -1;
        }
        int mask = keys.length - 1;
        int cell = mix(key) & mask;
        while (keys[cell] != EMPTY) {
            if (keys[cell] == key) {
                return slots[cell];
            }
            cell = (cell + 1) & mask;
        }
        return -1;
    }

    public int keyAt(int slot) {
        if (slot < 0 || slot >= size) {
            throw new IndexOutOfBoundsException("Posizione " + slot + " fuori da [0, " + size + ")");
        }
        return keyBySlot[slot];
    }

    public int size() {
        return size;
    }

    private void rehash() {
        int[] oldKeys = keys;
        int[] oldSlots = slots;
        keys = new int[oldKeys.length * 2];
        slots = new int[oldKeys.length * 2];

        int mask = keys.length - 1;
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldKeys[i] != EMPTY) {
                int cell = mix(oldKeys[i]) & mask;
                while (keys[cell] != EMPTY) {
                    cell = (cell + 1) & mask;
                }
                keys[cell] = oldKeys[i];
                slots[cell] = oldSlots[i];
            }
        }
    }

    /** Finalizzatore di MurmurHash3: distribuisce chiavi consecutive su tutta la tabella */
    private static int mix(int key) {
        int h = key;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
