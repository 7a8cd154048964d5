package edu.kyoto.fos.restruct;

public interface Printable {
  void printAt(int level, StringBuilder b);

  default StringBuilder indent(int i, StringBuilder b) {
    for(int j = 0; j < i; j++) {
      b.append("  ");
    }
    return b;
  }

  default String dump() {
    StringBuilder sb = new StringBuilder();
    this.printAt(0, sb);
    return sb.toString();
  }
}
