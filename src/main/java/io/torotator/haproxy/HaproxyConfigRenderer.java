package io.torotator.haproxy;

import freemarker.template.TemplateException;
import io.torotator.util.ConfigTemplates;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Renders {@code haproxy.cfg} from a {@link HaproxyDescriptor}. Output depends only on the descriptor;
 * backends are emitted in ascending port order.
 */
public final class HaproxyConfigRenderer {
    static final String TEMPLATE = "haproxy.cfg.ftl";

    private HaproxyConfigRenderer() {
    }

    public static String render(HaproxyDescriptor descriptor) throws RenderException {
        if (descriptor == null) {
            throw new RenderException("descriptor is missing");
        }
        checkPort("listen port", descriptor.port());
        if (descriptor.maxConn() < 1) {
            throw new RenderException("maxconn must be positive: " + descriptor.maxConn());
        }
        if (descriptor.balance() == null || !HaproxyDescriptor.BALANCE_POLICIES.contains(descriptor.balance())) {
            throw new RenderException("unknown balance policy: " + descriptor.balance()
                    + ", expected one of " + HaproxyDescriptor.BALANCE_POLICIES);
        }
        if (descriptor.statsEnabled()) {
            checkPort("stats port", descriptor.statsPort());
        }
        List<Integer> backends = new ArrayList<>(new TreeSet<>(descriptor.backends()));
        for (int backend : backends) {
            checkPort("backend port", backend);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("maxConn", descriptor.maxConn());
        model.put("statsPort", descriptor.statsEnabled() ? descriptor.statsPort() : 0);
        model.put("port", descriptor.port());
        model.put("balance", descriptor.balance());
        model.put("backends", backends);
        try {
            return ConfigTemplates.render(TEMPLATE, model);
        } catch (TemplateException | IOException e) {
            throw new RenderException("template " + TEMPLATE + " failed: " + e.getMessage(), e);
        }
    }

    private static void checkPort(String name, int port) throws RenderException {
        if (port < 1 || port > 65_535) {
            throw new RenderException("invalid " + name + ": " + port);
        }
    }
}
