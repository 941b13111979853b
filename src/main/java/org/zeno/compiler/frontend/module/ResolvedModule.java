package org.zeno.compiler.frontend.module;

import java.util.Map;

/**
 * The result of resolving an import path.
 */
public sealed interface ResolvedModule permits ResolvedModule.NativeModule, ResolvedModule.SourceModule {

    /**
     * A standard-library module whose functions map to bridge primitives.
     *
     * @param path    The import path.
     * @param exports The exported primitives by name.
     */
    record NativeModule(String path, Map<String, NativeFunction> exports) implements ResolvedModule {}

    /**
     * A Zeno source file that has to be compiled alongside the importing file.
     *
     * @param logicalName The normalized path of the file; identifies the module.
     * @param content     The file content.
     */
    record SourceModule(String logicalName, String content) implements ResolvedModule {}
}
