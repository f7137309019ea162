package org.gopy.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.gopy.target.Py;
import org.gopy.target.PyClassDef;
import org.gopy.target.PyFunctionDef;
import org.gopy.target.PyModule;
import org.gopy.target.PyPass;
import org.gopy.target.PyStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders lowered declarations into a module: classes with their methods, then type bindings,
 * then functions, then values. Within each group declarations keep their input order.
 */
public class ModuleAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModuleAssembler.class);

    public PyModule assemble(List<LoweredDecl> decls) {
        Map<String, List<PyStmt>> classBodies = new LinkedHashMap<>();
        List<PyStmt> bindings = new ArrayList<>();
        List<PyStmt> functions = new ArrayList<>();
        List<PyStmt> values = new ArrayList<>();

        for (LoweredDecl decl : decls) {
            if (decl.kind() == LoweredDecl.Kind.CLASS) {
                PyClassDef cls = (PyClassDef) decl.stmt();
                classBodies.put(cls.name(), new ArrayList<>(cls.body()));
            }
        }

        for (LoweredDecl decl : decls) {
            switch (decl.kind()) {
                case CLASS:
                    break;
                case TYPE_BINDING:
                    bindings.add(decl.stmt());
                    break;
                case FUNCTION:
                    functions.add(decl.stmt());
                    break;
                case VALUE:
                    values.add(decl.stmt());
                    break;
                case METHOD:
                    List<PyStmt> body = classBodies.get(decl.ownerType());
                    if (body != null) {
                        if (body.size() == 1 && body.get(0) instanceof PyPass) {
                            body.clear();
                        }
                        body.add(decl.stmt());
                    } else {
                        // owner class lives elsewhere; attach at import time
                        PyFunctionDef def = (PyFunctionDef) decl.stmt();
                        log.debug("method {} has no class {} in this module, bound as attribute", def.name(), decl.ownerType());
                        functions.add(def);
                        functions.add(Py.assign(Py.attr(Py.name(decl.ownerType()), def.name()), Py.name(def.name())));
                    }
                    break;
                default:
                    throw new IllegalStateException("unknown declaration kind " + decl.kind());
            }
        }

        List<PyStmt> body = new ArrayList<>();
        for (Map.Entry<String, List<PyStmt>> entry : classBodies.entrySet()) {
            body.add(new PyClassDef(entry.getKey(), List.of(), entry.getValue()));
        }
        body.addAll(bindings);
        body.addAll(functions);
        body.addAll(values);
        return new PyModule(body);
    }
}
