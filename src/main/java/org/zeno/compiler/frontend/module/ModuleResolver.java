package org.zeno.compiler.frontend.module;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the path of an import statement.
 */
public interface ModuleResolver {

    /**
     * Resolves an import path.
     * @param importPath    The path as written in the import statement.
     * @param importingFile The logical name of the file containing the import.
     * @return The resolved module, or empty if the path does not name any known module.
     * @throws IOException if the path names a source module that cannot be read.
     */
    Optional<ResolvedModule> resolve(String importPath, String importingFile) throws IOException;
}
