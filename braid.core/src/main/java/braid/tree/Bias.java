package braid.tree;

/*
 * Which side of an ambiguous position a seek or a clip should settle on.
 * LEFT rounds towards the start of the sequence, RIGHT towards the end.
 * */
public enum Bias {
  LEFT,
  RIGHT
}
