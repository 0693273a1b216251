package org.briltext.compiler.frontend.module;

import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.api.ICompiler;
import org.briltext.compiler.api.ModuleLoadException;
import org.briltext.compiler.frontend.io.SourceLoader;
import org.briltext.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads modules from {@code <directory>/<moduleName><extension>} and parses them
 * with the given compiler.
 */
public final class FileModuleLoader implements ModuleLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FileModuleLoader.class);

    public static final String DEFAULT_EXTENSION = ".bril";

    private final Path directory;
    private final String extension;
    private final ICompiler compiler;

    /**
     * @param directory The directory modules are read from.
     * @param extension The file extension appended to module names, including the dot.
     * @param compiler The compiler used to parse loaded modules.
     */
    public FileModuleLoader(Path directory, String extension, ICompiler compiler) {
        this.directory = directory;
        this.extension = extension;
        this.compiler = compiler;
    }

    /**
     * Creates a loader reading {@code .bril} files from the given directory.
     * @param directory The module directory.
     * @param compiler The compiler used to parse loaded modules.
     */
    public FileModuleLoader(Path directory, ICompiler compiler) {
        this(directory, DEFAULT_EXTENSION, compiler);
    }

    @Override
    public IrProgram load(String moduleName) throws BrilException {
        String fileName = moduleName + extension;
        Path path = directory.resolve(fileName);
        LOG.debug("Loading module '{}' from {}", moduleName, path);

        SourceLoader.LoadResult source;
        try {
            source = SourceLoader.loadFile(path);
        } catch (IOException e) {
            throw new ModuleLoadException(moduleName, "Failed to load " + fileName, e);
        }
        return compiler.parse(source.content(), source.logicalName());
    }
}
