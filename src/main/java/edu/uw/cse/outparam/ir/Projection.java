package edu.uw.cse.outparam.ir;

import java.util.Objects;

/**
 * One step of a {@link Place}: a pointer dereference, a field access or an
 * index into an array-like value.
 */
public abstract class Projection {

    private Projection() {
    }

    public static final Projection DEREF = new Deref();

    public static Projection field(String name) {
        return new Field(name);
    }

    public static Projection index(int local) {
        return new Index(local);
    }

    public static Projection constantIndex(long offset) {
        return new ConstantIndex(offset);
    }

    public static final class Deref extends Projection {
        private Deref() {
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    public static final class Field extends Projection {
        private final String name;

        private Field(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Field other)) return false;
            return name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }

    /** Index by the value of another local, as in {@code a[i]}. */
    public static final class Index extends Projection {
        private final int local;

        private Index(int local) {
            this.local = local;
        }

        public int getLocal() {
            return local;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Index other)) return false;
            return local == other.local;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(local) * 31 + 7;
        }

        @Override
        public String toString() {
            return "[_" + local + "]";
        }
    }

    /** Index by a literal, as in {@code a[3]}. */
    public static final class ConstantIndex extends Projection {
        private final long offset;

        private ConstantIndex(long offset) {
            this.offset = offset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ConstantIndex other)) return false;
            return offset == other.offset;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(offset) * 31 + 11;
        }

        @Override
        public String toString() {
            return "[" + offset + "]";
        }
    }
}
