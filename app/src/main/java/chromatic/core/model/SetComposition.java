package chromatic.core.model;

import chromatic.core.error.EmptyStructureException;
import chromatic.core.error.MalformedInputException;
import chromatic.core.error.StructuralViolationException;
import chromatic.util.CanonicalText;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered sequence of pairwise disjoint, non-empty blocks of positive integers. The union of the
 * blocks is the ground set.
 *
 * <p>Blocks are kept sorted so equal set compositions share the canonical text {@code
 * (2,4|1|3,5,6)}. The ground set is listed in discovery order: block by block, ascending inside a
 * block. That order drives {@link #relabel()} and positional {@link #relabel(List)}.
 */
public final class SetComposition implements Comparable<SetComposition> {
  public static final SetComposition EMPTY = new SetComposition(List.of());

  private final List<List<Integer>> blocks;
  private final List<Integer> groundSet;
  private final Map<Integer, Integer> blockIndex;

  private SetComposition(List<? extends Collection<Integer>> rawBlocks) {
    List<List<Integer>> sortedBlocks = new ArrayList<>(rawBlocks.size());
    Map<Integer, Integer> index = new HashMap<>();
    List<Integer> ground = new ArrayList<>();
    for (Collection<Integer> rawBlock : rawBlocks) {
      Objects.requireNonNull(rawBlock, "block");
      if (rawBlock.isEmpty()) {
        throw new MalformedInputException("Blocks must be non-empty, got " + rawBlocks);
      }
      List<Integer> block = new ArrayList<>(rawBlock);
      for (Integer element : block) {
        if (element == null || element <= 0) {
          throw new MalformedInputException(
              "All elements must be positive integers, got " + element);
        }
      }
      Collections.sort(block);
      for (Integer element : block) {
        if (index.putIfAbsent(element, sortedBlocks.size()) != null) {
          throw new StructuralViolationException(
              "Blocks are not disjoint: element " + element + " repeated in " + rawBlocks);
        }
        ground.add(element);
      }
      sortedBlocks.add(List.copyOf(block));
    }
    this.blocks = List.copyOf(sortedBlocks);
    this.groundSet = List.copyOf(ground);
    this.blockIndex = Map.copyOf(index);
  }

  public static SetComposition of(List<? extends Collection<Integer>> blocks) {
    Objects.requireNonNull(blocks, "blocks");
    return new SetComposition(blocks);
  }

  @SafeVarargs
  public static SetComposition of(Collection<Integer>... blocks) {
    return new SetComposition(List.of(blocks));
  }

  /** Reads the canonical text {@code (a,b|c|d,e)} or {@code ()}. */
  public static SetComposition parse(String text) {
    return new SetComposition(CanonicalText.parseBlocks(text));
  }

  public List<List<Integer>> blocks() {
    return blocks;
  }

  public List<Integer> block(int index) {
    return blocks.get(index);
  }

  public int blockCount() {
    return blocks.size();
  }

  /** Ground set in discovery order. */
  public List<Integer> groundSet() {
    return groundSet;
  }

  public int size() {
    return groundSet.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  public boolean contains(int element) {
    return blockIndex.containsKey(element);
  }

  /** Zero-based index of the block holding {@code element}, or -1 when absent. */
  public int blockIndexOf(int element) {
    Integer index = blockIndex.get(element);
    return index == null ? -1 : index;
  }

  public boolean isDisjointFrom(SetComposition other) {
    for (Integer element : other.groundSet) {
      if (blockIndex.containsKey(element)) {
        return false;
      }
    }
    return true;
  }

  public List<Integer> first() {
    if (blocks.isEmpty()) {
      throw new EmptyStructureException("Empty set composition has no first block");
    }
    return blocks.get(0);
  }

  public SetComposition rest() {
    if (blocks.isEmpty()) {
      throw new EmptyStructureException("Empty set composition cannot be rest-ed");
    }
    return new SetComposition(blocks.subList(1, blocks.size()));
  }

  public SetComposition prepend(Collection<Integer> block) {
    Objects.requireNonNull(block, "block");
    List<Collection<Integer>> next = new ArrayList<>(blocks.size() + 1);
    next.add(block);
    next.addAll(blocks);
    return new SetComposition(next);
  }

  /** Composition of block sizes. */
  public Composition alpha() {
    List<Integer> sizes = new ArrayList<>(blocks.size());
    for (List<Integer> block : blocks) {
      sizes.add(block.size());
    }
    return new Composition(sizes);
  }

  /** Relabels the ground set to {@code 1..k} following {@link #groundSet()} order. */
  public SetComposition relabel() {
    Map<Integer, Integer> mapping = new HashMap<>();
    for (int i = 0; i < groundSet.size(); i++) {
      mapping.put(groundSet.get(i), i + 1);
    }
    return relabel(mapping);
  }

  /** Positional relabeling: the i-th ground set element becomes {@code labels.get(i)}. */
  public SetComposition relabel(List<Integer> labels) {
    Objects.requireNonNull(labels, "labels");
    if (labels.size() != groundSet.size()) {
      throw new StructuralViolationException(
          "Relabeling needs "
              + groundSet.size()
              + " labels for ground set "
              + groundSet
              + ", got "
              + labels.size());
    }
    Map<Integer, Integer> mapping = new HashMap<>();
    for (int i = 0; i < groundSet.size(); i++) {
      mapping.put(groundSet.get(i), labels.get(i));
    }
    return relabel(mapping);
  }

  /**
   * Relabels through an explicit map. The map must be defined on every ground set element and
   * injective there; entries for other keys are ignored.
   */
  public SetComposition relabel(Map<Integer, Integer> mapping) {
    Objects.requireNonNull(mapping, "mapping");
    Set<Integer> images = new HashSet<>();
    List<List<Integer>> relabeled = new ArrayList<>(blocks.size());
    for (List<Integer> block : blocks) {
      List<Integer> image = new ArrayList<>(block.size());
      for (Integer element : block) {
        Integer target = mapping.get(element);
        if (target == null) {
          throw new StructuralViolationException(
              "Relabeling is not defined on element " + element + " of " + this);
        }
        if (!images.add(target)) {
          throw new StructuralViolationException(
              "Relabeling is not injective: label " + target + " used twice for " + this);
        }
        image.add(target);
      }
      relabeled.add(image);
    }
    return new SetComposition(relabeled);
  }

  /** Adds {@code offset} to every element. */
  public SetComposition shift(int offset) {
    Map<Integer, Integer> mapping = new HashMap<>();
    for (Integer element : groundSet) {
      mapping.put(element, element + offset);
    }
    return relabel(mapping);
  }

  /** Block by block, lexicographic on sorted block contents, then by block count. */
  @Override
  public int compareTo(SetComposition other) {
    int shared = Math.min(blocks.size(), other.blocks.size());
    for (int i = 0; i < shared; i++) {
      int cmp = compareBlocks(blocks.get(i), other.blocks.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(blocks.size(), other.blocks.size());
  }

  private static int compareBlocks(List<Integer> left, List<Integer> right) {
    int shared = Math.min(left.size(), right.size());
    for (int i = 0; i < shared; i++) {
      int cmp = Integer.compare(left.get(i), right.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SetComposition other)) {
      return false;
    }
    return blocks.equals(other.blocks);
  }

  @Override
  public int hashCode() {
    return blocks.hashCode();
  }

  @Override
  public String toString() {
    return CanonicalText.formatBlocks(blocks);
  }
}
