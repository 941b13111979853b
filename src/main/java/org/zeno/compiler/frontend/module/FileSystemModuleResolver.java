package org.zeno.compiler.frontend.module;

import org.zeno.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves {@code std/...} paths against the {@link StandardLibrary} table and {@code ./} or
 * {@code ../} paths against the directory of the importing file. The source extension is
 * appended when the path does not already end with it.
 */
public class FileSystemModuleResolver implements ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSystemModuleResolver.class);

    private final String sourceExtension;

    public FileSystemModuleResolver(String sourceExtension) {
        this.sourceExtension = sourceExtension;
    }

    @Override
    public Optional<ResolvedModule> resolve(String importPath, String importingFile) throws IOException {
        if (StandardLibrary.isStandardPath(importPath)) {
            return StandardLibrary.module(importPath)
                    .map(exports -> new ResolvedModule.NativeModule(importPath, exports));
        }
        if (!SourceLoader.isRelativePath(importPath)) {
            return Optional.empty();
        }
        String fileName = importPath.endsWith(sourceExtension) ? importPath : importPath + sourceExtension;
        Path resolved = baseDirectory(importingFile).resolve(fileName).normalize();
        log.debug("Resolving module '{}' imported by {} to {}", importPath, importingFile, resolved);
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(resolved);
        return Optional.of(new ResolvedModule.SourceModule(loaded.logicalName(), loaded.content()));
    }

    private static Path baseDirectory(String importingFile) {
        Path parent = Path.of(importingFile).toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }
}
