package edu.uw.cse.outparam.frontend;

import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.ProgramContext;

import java.util.List;

/**
 * A program ready for analysis: its type context and the bodies of its functions.
 */
public record LoadedProgram(ProgramContext context, List<FunctionBody> functions) {

    public LoadedProgram {
        functions = List.copyOf(functions);
    }
}
