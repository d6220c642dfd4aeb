package io.github.manjago.pseudomem.exec;

/**
 * Debugger view of one visible variable.
 *
 * @param value display form; {@code ?} marks unassigned values or elements
 */
public record VariableSnapshot(String name, String type, int address, String value, boolean initialized) {

    static VariableSnapshot of(String name, Variable variable) {
        return new VariableSnapshot(name, variable.typeName(), variable.getAddress(),
                variable.render(), variable.isInitialized());
    }

    @Override
    public String toString() {
        return String.format("%s : %s @ 0x%04X = %s", name, type, address, value);
    }
}
