package org.lexicon.util.fsa;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.lucene.util.BytesRef;

/**
 * Serializes sets of byte sequences into all supported automaton encodings. The automata are plain
 * tries (no state sharing), which is enough to exercise the readers.
 */
public final class FSAFixtures {

    /** Binary encodings that can be written. */
    public enum Format {
        FIXED, COMPACT, VINT
    }

    private static final int GOTO_LENGTH = 4;
    private static final int NODE_DATA_LENGTH = 4;

    private FSAFixtures() {}

    static final class Node {
        final List<Arc> arcs = new ArrayList<>();
        int offset;
        int count;
    }

    static final class Arc {
        final byte label;
        boolean isFinal;
        boolean next;
        int labelIndex;
        Node target;

        Arc(byte label) {
            this.label = label;
        }
    }

    /** Builds an automaton from UTF-8 strings. */
    public static FSA build(Format format, boolean numbers, String... sequences) throws IOException {
        final List<BytesRef> refs = new ArrayList<>();
        for (String s : sequences) {
            refs.add(new BytesRef(s));
        }
        return build(format, numbers, refs);
    }

    /** Builds an automaton containing the given sequences. */
    public static FSA build(Format format, boolean numbers, Collection<BytesRef> sequences) throws IOException {
        return FSA.read(new ByteArrayInputStream(serialize(format, numbers, sequences)));
    }

    /** Serializes the given (non-empty) sequences, including the header. */
    public static byte[] serialize(Format format, boolean numbers, Collection<BytesRef> sequences) throws IOException {
        final Node root = buildTrie(sequences);
        computeCounts(root);
        final List<Node> order = new ArrayList<>();
        layout(root, order);

        switch (format) {
            case FIXED:
                return writeFixed(root, order, numbers);
            case COMPACT:
                return writeCompact(root, order, numbers);
            case VINT:
                return writeVInt(root, order, numbers);
            default:
                throw new AssertionError(format);
        }
    }

    private static Node buildTrie(Collection<BytesRef> sequences) {
        final TreeSet<BytesRef> sorted = new TreeSet<>();
        for (BytesRef ref : sequences) {
            if (ref.length == 0) {
                throw new IllegalArgumentException("Empty sequences are not supported.");
            }
            sorted.add(BytesRef.deepCopyOf(ref));
        }

        final Node root = new Node();
        for (BytesRef seq : sorted) {
            Node node = root;
            for (int i = 0; i < seq.length; i++) {
                final byte label = seq.bytes[seq.offset + i];
                // Input is sorted, so a matching arc can only be the last one.
                Arc arc = node.arcs.isEmpty() ? null : node.arcs.get(node.arcs.size() - 1);
                if (arc == null || arc.label != label) {
                    arc = new Arc(label);
                    node.arcs.add(arc);
                }
                if (i == seq.length - 1) {
                    arc.isFinal = true;
                } else {
                    if (arc.target == null) {
                        arc.target = new Node();
                    }
                    node = arc.target;
                }
            }
        }
        return root;
    }

    private static int computeCounts(Node node) {
        int count = 0;
        for (Arc arc : node.arcs) {
            if (arc.isFinal) {
                count++;
            }
            if (arc.target != null) {
                count += computeCounts(arc.target);
            }
        }
        node.count = count;
        return count;
    }

    /** Orders states so that the target of each state's last arc directly follows that state. */
    private static void layout(Node node, List<Node> order) {
        order.add(node);
        final Arc last = node.arcs.get(node.arcs.size() - 1);
        if (last.target != null) {
            last.next = true;
            layout(last.target, order);
        }
        for (Arc arc : node.arcs) {
            if (arc != last && arc.target != null) {
                layout(arc.target, order);
            }
        }
    }

    private static boolean isLast(Node node, Arc arc) {
        return node.arcs.get(node.arcs.size() - 1) == arc;
    }

    private static int targetOffset(Arc arc) {
        return arc.target == null ? 0 : arc.target.offset;
    }

    private static void writeLE(ByteArrayOutputStream out, int value, int bytes) {
        for (int i = 0; i < bytes; i++) {
            out.write(value >>> (8 * i));
        }
    }

    private static void writeVInt(ByteArrayOutputStream out, int value) {
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value);
    }

    private static int vIntLength(int value) {
        int len = 1;
        while ((value & ~0x7F) != 0) {
            value >>>= 7;
            len++;
        }
        return len;
    }

    /** Assigns label table indices (1..max) to the most frequent labels of eligible arcs. */
    private static byte[] assignLabels(List<Node> order, int max, boolean nextArcsOnly) {
        final Map<Byte, Integer> frequencies = new HashMap<>();
        for (Node n : order) {
            for (Arc a : n.arcs) {
                if (!nextArcsOnly || a.next) {
                    frequencies.merge(a.label, 1, Integer::sum);
                }
            }
        }
        final List<Map.Entry<Byte, Integer>> byFrequency = new ArrayList<>(frequencies.entrySet());
        byFrequency.sort(Comparator.comparing((Map.Entry<Byte, Integer> e) -> -e.getValue())
                .thenComparing(Map.Entry::getKey));

        final int size = Math.min(max, byFrequency.size());
        final byte[] table = new byte[size + 1];
        final Map<Byte, Integer> index = new HashMap<>();
        for (int i = 0; i < size; i++) {
            table[i + 1] = byFrequency.get(i).getKey();
            index.put(table[i + 1], i + 1);
        }
        for (Node n : order) {
            for (Arc a : n.arcs) {
                if (!nextArcsOnly || a.next) {
                    a.labelIndex = index.getOrDefault(a.label, 0);
                }
            }
        }
        return table;
    }

    private static byte[] writeFixed(Node root, List<Node> order, boolean numbers) throws IOException {
        final int nodeDataLength = numbers ? NODE_DATA_LENGTH : 0;
        final int arcSize = 1 + GOTO_LENGTH;

        // The dummy state and the epsilon state come first, with one arc each.
        int offset = 2 * (nodeDataLength + arcSize);
        for (Node n : order) {
            n.offset = offset;
            offset += nodeDataLength;
            for (Arc a : n.arcs) {
                offset += a.next ? 2 : arcSize;
            }
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        FSAHeader.write(out, FixedFSA.VERSION);
        out.write('_');
        out.write('+');
        out.write((nodeDataLength << 4) | GOTO_LENGTH);
        final int base = out.size();

        writeLE(out, 0, nodeDataLength);
        out.write(0);
        writeLE(out, FixedFSA.BIT_LAST_ARC, GOTO_LENGTH);

        writeLE(out, root.count, nodeDataLength);
        out.write(0);
        writeLE(out, (root.offset << 3) | FixedFSA.BIT_LAST_ARC, GOTO_LENGTH);

        for (Node n : order) {
            assert out.size() - base == n.offset;
            writeLE(out, n.count, nodeDataLength);
            for (Arc a : n.arcs) {
                out.write(a.label);
                final int flags = (a.isFinal ? FixedFSA.BIT_FINAL_ARC : 0) | (isLast(n, a) ? FixedFSA.BIT_LAST_ARC : 0);
                if (a.next) {
                    out.write(flags | FixedFSA.BIT_TARGET_NEXT);
                } else {
                    writeLE(out, (targetOffset(a) << 3) | flags, GOTO_LENGTH);
                }
            }
        }
        return out.toByteArray();
    }

    private static byte[] writeCompact(Node root, List<Node> order, boolean numbers) throws IOException {
        final int nodeDataLength = numbers ? NODE_DATA_LENGTH : 0;
        final int arcSize = 1 + GOTO_LENGTH;
        final byte[] labels = assignLabels(order, CompactFSA.LABEL_MAPPING_SIZE - 1, true);

        int offset = 2 * (nodeDataLength + arcSize);
        for (Node n : order) {
            n.offset = offset;
            offset += nodeDataLength;
            for (Arc a : n.arcs) {
                offset += a.next ? (a.labelIndex > 0 ? 1 : 2) : arcSize;
            }
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        FSAHeader.write(out, CompactFSA.VERSION);
        out.write('_');
        out.write('+');
        out.write((nodeDataLength << 4) | GOTO_LENGTH);
        final byte[] mapping = new byte[CompactFSA.LABEL_MAPPING_SIZE];
        System.arraycopy(labels, 0, mapping, 0, labels.length);
        out.write(mapping);
        final int base = out.size();

        writeLE(out, 0, nodeDataLength);
        writeCompactGoto(out, (byte) 0, CompactFSA.BIT_LAST_ARC);

        writeLE(out, root.count, nodeDataLength);
        writeCompactGoto(out, (byte) 0, (root.offset << 3) | CompactFSA.BIT_LAST_ARC);

        for (Node n : order) {
            assert out.size() - base == n.offset;
            writeLE(out, n.count, nodeDataLength);
            for (Arc a : n.arcs) {
                final int flags = (a.isFinal ? CompactFSA.BIT_FINAL_ARC : 0) | (isLast(n, a) ? CompactFSA.BIT_LAST_ARC : 0);
                if (a.next) {
                    out.write((a.labelIndex << 3) | CompactFSA.BIT_TARGET_NEXT | flags);
                    if (a.labelIndex == 0) {
                        out.write(a.label);
                    }
                } else {
                    writeCompactGoto(out, a.label, (targetOffset(a) << 3) | flags);
                }
            }
        }
        return out.toByteArray();
    }

    /** The lowest goto byte (with flags) comes first, then the label, then the remaining goto bytes. */
    private static void writeCompactGoto(ByteArrayOutputStream out, byte label, int value) {
        out.write(value);
        out.write(label);
        for (int i = 1; i < GOTO_LENGTH; i++) {
            out.write(value >>> (8 * i));
        }
    }

    private static byte[] writeVInt(Node root, List<Node> order, boolean numbers) throws IOException {
        final byte[] labels = assignLabels(order, VIntFSA.LABEL_INDEX_SIZE, false);

        // Address lengths depend on offsets; iterate until the layout is stable.
        int epsilonSize;
        boolean changed;
        do {
            changed = false;
            epsilonSize = (numbers ? vIntLength(root.count) : 0) + 2 + vIntLength(root.offset);
            int offset = epsilonSize;
            for (Node n : order) {
                if (n.offset != offset) {
                    n.offset = offset;
                    changed = true;
                }
                offset += numbers ? vIntLength(n.count) : 0;
                for (Arc a : n.arcs) {
                    offset += 1 + (a.labelIndex == 0 ? 1 : 0) + (a.next ? 0 : vIntLength(targetOffset(a)));
                }
            }
        } while (changed);

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        FSAHeader.write(out, VIntFSA.VERSION);
        final EnumSet<FSAFlags> flags = EnumSet.of(FSAFlags.FLEXIBLE, FSAFlags.STOPBIT, FSAFlags.NEXTBIT);
        if (numbers) {
            flags.add(FSAFlags.NUMBERS);
        }
        final short flagBits = FSAFlags.asShort(flags);
        out.write(flagBits >> 8);
        out.write(flagBits);
        out.write(labels.length);
        out.write(labels);
        final int base = out.size();

        if (numbers) {
            writeVInt(out, root.count);
        }
        out.write(VIntFSA.BIT_LAST_ARC);
        out.write(0);
        writeVInt(out, root.offset);

        for (Node n : order) {
            assert out.size() - base == n.offset;
            if (numbers) {
                writeVInt(out, n.count);
            }
            for (Arc a : n.arcs) {
                out.write((a.next ? VIntFSA.BIT_TARGET_NEXT : 0)
                        | (isLast(n, a) ? VIntFSA.BIT_LAST_ARC : 0)
                        | (a.isFinal ? VIntFSA.BIT_FINAL_ARC : 0)
                        | a.labelIndex);
                if (a.labelIndex == 0) {
                    out.write(a.label);
                }
                if (!a.next) {
                    writeVInt(out, targetOffset(a));
                }
            }
        }
        return out.toByteArray();
    }
}
