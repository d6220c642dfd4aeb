package io.github.manjago.pseudomem.exec;

/**
 * Resolved assignable place: a scalar variable (index -1) or one array element.
 */
record Location(Variable variable, int index, String label) {

    int address() {
        return variable.addressOf(index);
    }
}
