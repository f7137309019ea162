package org.gopy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.gopy.lowering.FileContext;
import org.gopy.lowering.LoweredDecl;
import org.gopy.lowering.LoweringEngine;
import org.gopy.lowering.ModuleAssembler;
import org.gopy.lowering.NamingScope;
import org.gopy.source.ast.Decl;
import org.gopy.source.ast.SourceFile;
import org.gopy.source.ast.Stmt;
import org.gopy.source.types.TypeInfo;
import org.gopy.target.PyModule;
import org.gopy.target.PyStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: lowers resolved Go statements, declarations or whole packages into Python trees.
 * <p>
 * Each call is one compilation with its own naming scope, so names are stable within a call
 * and independent across calls. Instances hold no per-compilation state and may be reused.
 */
public class GoPy {

    private static final Logger log = LoggerFactory.getLogger(GoPy.class);

    private final TypeInfo typeInfo;
    private final LoweringOptions options;
    private final LoweringEngine engine;
    private final ModuleAssembler assembler = new ModuleAssembler();

    public GoPy(TypeInfo typeInfo) {
        this(typeInfo, LoweringOptions.defaults());
    }

    public GoPy(TypeInfo typeInfo, LoweringOptions options) {
        this(typeInfo, options, new LoweringEngine());
    }

    public GoPy(TypeInfo typeInfo, LoweringOptions options, LoweringEngine engine) {
        this.typeInfo = typeInfo;
        this.options = options;
        this.engine = engine;
    }

    /**
     * A file-level context over a fresh root scope with every package-level name reserved.
     */
    public FileContext newContext() {
        NamingScope root = NamingScope.root();
        root.reserve(typeInfo.packageLevelDefinitions());
        return new FileContext(typeInfo, root, options, null);
    }

    public List<PyStmt> lowerStatement(Stmt stmt) {
        return engine.statements().lower(stmt, newContext());
    }

    public List<LoweredDecl> lowerDecl(Decl decl) {
        return engine.declarations().lower(decl, newContext());
    }

    /**
     * Lowers every declaration of the given files, which must belong to one package, into a
     * single module.
     */
    public PyModule compileFiles(List<SourceFile> files) {
        long start = System.nanoTime();
        FileContext packageContext = newContext();
        List<LoweredDecl> decls = new ArrayList<>();
        for (SourceFile file : files) {
            log.debug("lowering {} ({} declarations)", file.name(), file.decls().size());
            FileContext ctx = packageContext.withComments(file.comments());
            for (Decl decl : file.decls()) {
                decls.addAll(engine.declarations().lower(decl, ctx));
            }
        }
        PyModule module = assembler.assemble(decls);
        log.info("Lowered {} file(s) into {} module statements in {} ms", files.size(), module.body().size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return module;
    }

    public LoweringOptions getOptions() {
        return options;
    }
}
