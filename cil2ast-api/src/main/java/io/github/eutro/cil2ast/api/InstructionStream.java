package io.github.eutro.cil2ast.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flat method body, as supplied by a {@link MetadataSource}.
 */
public final class InstructionStream {
    private final List<Instruction> instructions;
    private final List<LocalVariable> locals;

    /**
     * Construct an instruction stream.
     *
     * @param instructions The instructions, ordered by offset.
     * @param locals       The declared locals, ordered by index.
     */
    public InstructionStream(List<Instruction> instructions, List<LocalVariable> locals) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<LocalVariable> getLocals() {
        return locals;
    }

    /**
     * Get the offset one past the last instruction.
     *
     * @return The code size.
     */
    public int getCodeSize() {
        if (instructions.isEmpty()) return 0;
        return instructions.get(instructions.size() - 1).getOffset() + 1;
    }

    /**
     * Find the index of the instruction at the given offset.
     *
     * @param offset The IL offset.
     * @return The index, or -1 if no instruction starts at that offset.
     */
    public int indexOf(int offset) {
        int lo = 0;
        int hi = instructions.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int midOffset = instructions.get(mid).getOffset();
            if (midOffset < offset) {
                lo = mid + 1;
            } else if (midOffset > offset) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
