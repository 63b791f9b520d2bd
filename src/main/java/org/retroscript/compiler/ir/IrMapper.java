package org.retroscript.compiler.ir;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.format.Formatter;
import org.retroscript.compiler.frontend.parser.ParseResult;
import org.retroscript.compiler.frontend.parser.Parser;
import org.retroscript.compiler.frontend.parser.ast.ConstStmt;
import org.retroscript.compiler.frontend.parser.ast.FlowDecl;
import org.retroscript.compiler.frontend.parser.ast.HotkeysDecl;
import org.retroscript.compiler.frontend.parser.ast.InterruptDecl;
import org.retroscript.compiler.frontend.parser.ast.Program;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.ir.irgen.IrConverterRegistry;
import org.retroscript.compiler.ir.irgen.IrGenContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps between the AST and the flat, GUI-facing IR.
 * <p>
 * Each statement of a flow or interrupt body becomes exactly one action. Nested statements of
 * compound statements are not inlined; their marker actions carry verbatim source instead, so
 * {@link #irToCode(ScriptIR)} reproduces them unchanged.
 */
public class IrMapper {

    private static final Logger log = LoggerFactory.getLogger(IrMapper.class);

    private final IrConverterRegistry registry;

    public IrMapper() {
        this(IrConverterRegistry.initializeWithDefaults());
    }

    public IrMapper(IrConverterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Projects a parsed program into IR.
     */
    public ScriptIR astToIr(Program program) {
        ScriptIR ir = new ScriptIR();
        IrGenContext ctx = new IrGenContext();

        HotkeysDecl hotkeys = program.hotkeys();
        if (hotkeys != null) {
            HotkeysIR hotkeysIr = new HotkeysIR();
            hotkeys.bindings().forEach(hotkeysIr::setBinding);
            ir.setHotkeys(hotkeysIr);
        }
        for (ConstStmt constant : program.constants()) {
            ir.getConstants().add(new ConstantIR(constant.name(), ctx.value(constant.value())));
        }
        for (FlowDecl flow : program.flows()) {
            FlowIR flowIr = new FlowIR(flow.name());
            ctx.beginBody(flowIr.getActions());
            for (Statement statement : flow.body().statements()) {
                registry.convert(statement, ctx);
            }
            ir.getFlows().add(flowIr);
        }
        for (InterruptDecl interrupt : program.interrupts()) {
            InterruptIR interruptIr = new InterruptIR(interrupt.priority(), interrupt.whenAsset());
            ctx.beginBody(interruptIr.getActions());
            for (Statement statement : interrupt.body().statements()) {
                registry.convert(statement, ctx);
            }
            ir.getInterrupts().add(interruptIr);
        }
        log.debug("Mapped {} flows and {} interrupts to IR", ir.getFlows().size(), ir.getInterrupts().size());
        return ir;
    }

    /**
     * Regenerates canonical source text from IR.
     */
    public String irToCode(ScriptIR ir) {
        String code = new IrCodeGenerator().generate(ir);
        return Formatter.formatCode(code);
    }

    /**
     * Parses text into IR. Any parse diagnostic yields an empty IR marked invalid, with the
     * diagnostic messages recorded as its parse errors.
     */
    public IrParseResult parseToIr(String text) {
        ParseResult result = new Parser(text).parse();
        if (!result.diagnostics().isEmpty()) {
            ScriptIR invalid = new ScriptIR();
            invalid.setValid(false);
            result.diagnostics().stream().map(Diagnostic::toString).forEach(invalid.getParseErrors()::add);
            return new IrParseResult(invalid, result.diagnostics());
        }
        return new IrParseResult(astToIr(result.program()), result.diagnostics());
    }
}
