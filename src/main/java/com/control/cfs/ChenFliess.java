package com.control.cfs;

import com.control.cfs.dsl.SeriesBuilder;
import com.control.cfs.io.SystemCompiler;
import com.control.cfs.io.SystemDefinitionLoader;

import java.nio.file.Path;

/**
 * Truncated Chen-Fliess series of control-affine systems.
 *
 * <h2>Model</h2>
 * <p>
 * For a system ż = g0(z) + Σ u_i(t) g_i(z), y = h(z), started at z0, the
 * input-output map is approximated by
 *
 * <pre>
 * F_c^N[u](t) = Σ_{|η| ≤ N} (c, η) E_η[u](t)
 * </pre>
 *
 * <ul>
 * <li><b>Coefficients</b> (c, η) = L_η h(z0) depend only on the system and
 * z0. They are derived symbolically once per depth and compiled.</li>
 * <li><b>Iterated integrals</b> E_η[u] depend only on the input. They are
 * built layer by layer with Chen's identity.</li>
 * <li><b>Words</b> η are laid out once by a
 * {@link com.control.cfs.word.WordIndex}; both tables use that layout so the
 * series is a row-by-row inner product.</li>
 * </ul>
 */
public final class ChenFliess {

    private ChenFliess() {
    }

    /**
     * Entry point: create a new series builder.
     *
     * @param name A descriptive name for the model.
     * @return A new {@link SeriesBuilder}.
     */
    public static SeriesBuilder builder(String name) {
        return SeriesBuilder.create(name);
    }

    /**
     * Loads and compiles a JSON system definition from disk.
     */
    public static ChenFliessSeries fromJson(Path path) {
        return new SystemCompiler().compile(SystemDefinitionLoader.load(path));
    }

    /**
     * Loads and compiles a JSON system definition from the classpath, e.g.
     * {@code systems/pendulum.json}.
     */
    public static ChenFliessSeries fromResource(String resource) {
        return new SystemCompiler().compile(SystemDefinitionLoader.loadResource(resource));
    }
}
