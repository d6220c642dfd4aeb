package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.ArrayBounds;
import io.github.manjago.pseudomem.lang.DataType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Mutable storage cell behind a name.
 *
 * <p>A BYREF parameter binds a second name to the same instance, so writes through
 * either name are the same write. Scalars hold one value; arrays hold their elements
 * flattened row-major. Every variable mirrors its contents into an arena block
 * starting at {@link #getAddress()}.
 */
public final class Variable {

    private final String name;
    private final DataType type;
    private final @Nullable DataType elementType;
    private final List<ArrayBounds> dimensions;
    private final boolean constant;
    private final int address;

    private @Nullable Value value;
    private final @Nullable Value[] cells;
    private boolean released = false;

    private Variable(String name, DataType type, @Nullable DataType elementType,
                     List<ArrayBounds> dimensions, boolean constant, int address) {
        this.name = name;
        this.type = type;
        this.elementType = elementType;
        this.dimensions = List.copyOf(dimensions);
        this.constant = constant;
        this.address = address;
        this.cells = type == DataType.ARRAY ? new Value[cellCount(dimensions)] : null;
    }

    static Variable scalar(String name, DataType type, int address) {
        return new Variable(name, type, null, List.of(), false, address);
    }

    static Variable constant(String name, DataType type, int address) {
        return new Variable(name, type, null, List.of(), true, address);
    }

    static Variable array(String name, DataType elementType, List<ArrayBounds> dimensions, int address) {
        return new Variable(name, DataType.ARRAY, elementType, dimensions, false, address);
    }

    static int cellCount(List<ArrayBounds> dimensions) {
        int count = 1;
        for (ArrayBounds bounds : dimensions) {
            count = Math.multiplyExact(count, bounds.size());
        }
        return count;
    }

    // ========== Accessors ==========

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public @Nullable DataType getElementType() {
        return elementType;
    }

    public List<ArrayBounds> getDimensions() {
        return dimensions;
    }

    public boolean isArray() {
        return type == DataType.ARRAY;
    }

    public boolean isConstant() {
        return constant;
    }

    public int getAddress() {
        return address;
    }

    /**
     * Number of arena slots this variable occupies.
     */
    public int getCellCount() {
        return cells != null ? cells.length : 1;
    }

    /**
     * True once FREE released this variable's block.
     */
    public boolean isReleased() {
        return released;
    }

    /**
     * Declared type of one element: the element type for arrays, the variable type otherwise.
     */
    public DataType slotType() {
        return elementType != null ? elementType : type;
    }

    /**
     * Type as written in a declaration, e.g. {@code ARRAY[1:10] OF INTEGER}.
     */
    public String typeName() {
        if (!isArray()) {
            return type.name();
        }
        StringJoiner joiner = new StringJoiner(", ", "ARRAY[", "] OF " + elementType);
        dimensions.forEach(d -> joiner.add(d.toString()));
        return joiner.toString();
    }

    /**
     * @param index flat element index for arrays, -1 for scalars
     * @return the stored value, or null if never assigned
     */
    public @Nullable Value get(int index) {
        return cells != null ? cells[index] : value;
    }

    public boolean isInitialized() {
        if (cells == null) {
            return value != null;
        }
        for (Value cell : cells) {
            if (cell != null) {
                return true;
            }
        }
        return false;
    }

    void set(int index, Value newValue) {
        if (cells != null) {
            cells[index] = newValue;
        } else {
            value = newValue;
        }
    }

    void markReleased() {
        released = true;
    }

    /**
     * Flat row-major index for the given subscripts, or -1 if any is out of bounds.
     */
    int flatIndex(List<Integer> subscripts) {
        int flat = 0;
        for (int d = 0; d < dimensions.size(); d++) {
            ArrayBounds bounds = dimensions.get(d);
            int subscript = subscripts.get(d);
            if (!bounds.contains(subscript)) {
                return -1;
            }
            flat = flat * bounds.size() + (subscript - bounds.lower());
        }
        return flat;
    }

    /**
     * Source-style label of one element, e.g. {@code grid[2, 3]}.
     */
    String elementLabel(int flat) {
        if (cells == null) {
            return name;
        }
        int[] subscripts = new int[dimensions.size()];
        int rest = flat;
        for (int d = dimensions.size() - 1; d >= 0; d--) {
            ArrayBounds bounds = dimensions.get(d);
            subscripts[d] = bounds.lower() + rest % bounds.size();
            rest /= bounds.size();
        }
        StringJoiner joiner = new StringJoiner(", ", name + "[", "]");
        for (int subscript : subscripts) {
            joiner.add(Integer.toString(subscript));
        }
        return joiner.toString();
    }

    /**
     * Arena address of one element (or of the scalar when index is -1).
     */
    int addressOf(int index) {
        return address + Math.max(index, 0);
    }

    /**
     * Display form for debuggers: the value, or a bracketed element list for arrays.
     */
    public String render() {
        if (cells == null) {
            return value != null ? value.display() : "?";
        }
        List<String> parts = new ArrayList<>(cells.length);
        for (Value cell : cells) {
            parts.add(cell != null ? cell.display() : "?");
        }
        return "[" + String.join(", ", parts) + "]";
    }

    @Override
    public String toString() {
        return name + " : " + typeName() + " @ " + address + " = " + render();
    }
}
