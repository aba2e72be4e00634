package fun.fengwk.rsh.core.service.browser.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory render engine whose contexts carry a cookie jar through storage state json.
 *
 * <p>Each render sets the cookie {@code last-url} to the rendered url, which makes state carried from one
 * render into the next observable.
 *
 * @author fengwk
 */
public class FakeRenderEngine implements RenderEngine {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final List<FakeRenderContext> contexts = new CopyOnWriteArrayList<>();
    private final AtomicInteger activeContexts = new AtomicInteger(0);
    private volatile boolean connected = true;
    private volatile RuntimeException createFailure;
    private volatile RuntimeException renderFailure;
    private volatile RuntimeException captureFailure;
    private volatile RuntimeException closeFailure;
    private volatile int pageStatus = 200;

    @Override
    public RenderContext newIsolatedContext(ContextOptions options) {
        if (createFailure != null) {
            throw createFailure;
        }
        FakeRenderContext context = new FakeRenderContext(options);
        contexts.add(context);
        activeContexts.incrementAndGet();
        return context;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public int activeContexts() {
        return activeContexts.get();
    }

    @Override
    public void close() {
        connected = false;
    }

    public List<FakeRenderContext> contexts() {
        return contexts;
    }

    public FakeRenderContext lastContext() {
        return contexts.get(contexts.size() - 1);
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public void failCreate(RuntimeException failure) {
        this.createFailure = failure;
    }

    public void failRender(RuntimeException failure) {
        this.renderFailure = failure;
    }

    public void failCapture(RuntimeException failure) {
        this.captureFailure = failure;
    }

    public void failClose(RuntimeException failure) {
        this.closeFailure = failure;
    }

    public void setPageStatus(int pageStatus) {
        this.pageStatus = pageStatus;
    }

    public static String storageState(Map<String, String> cookies) {
        List<Map<String, String>> cookieList = new ArrayList<>();
        cookies.forEach((name, value) -> {
            Map<String, String> cookie = new LinkedHashMap<>();
            cookie.put("name", name);
            cookie.put("value", value);
            cookieList.add(cookie);
        });
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("cookies", cookieList);
        state.put("origins", List.of());
        try {
            return OBJECT_MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(ex);
        }
    }

    static Map<String, String> parseCookies(String storageState) {
        Map<String, String> cookies = new LinkedHashMap<>();
        if (storageState == null) {
            return cookies;
        }
        try {
            Map<String, Object> state = OBJECT_MAPPER.readValue(storageState, new TypeReference<>() {
            });
            Object cookieList = state.get("cookies");
            if (cookieList instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Map<?, ?> cookie) {
                        cookies.put(String.valueOf(cookie.get("name")), String.valueOf(cookie.get("value")));
                    }
                }
            }
            return cookies;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid storage state", ex);
        }
    }

    public class FakeRenderContext implements RenderContext {

        private final ContextOptions options;
        private final Map<String, String> cookies;
        private final Map<String, String> cookiesBeforeNavigation = new LinkedHashMap<>();
        private final AtomicInteger closeCount = new AtomicInteger(0);
        private final AtomicInteger renderCount = new AtomicInteger(0);

        private FakeRenderContext(ContextOptions options) {
            this.options = options;
            this.cookies = parseCookies(options.getStorageState());
        }

        @Override
        public RenderedPage render(String url, long navigateTimeoutMs, long settleTimeoutMs) {
            renderCount.incrementAndGet();
            cookiesBeforeNavigation.putAll(cookies);
            cookies.put("last-url", url);
            if (renderFailure != null) {
                throw renderFailure;
            }
            return new RenderedPage("<html><body>" + url + "</body></html>", pageStatus);
        }

        @Override
        public String captureState() {
            if (captureFailure != null) {
                throw captureFailure;
            }
            return storageState(cookies);
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
            activeContexts.decrementAndGet();
            if (closeFailure != null) {
                throw closeFailure;
            }
        }

        public ContextOptions options() {
            return options;
        }

        public Map<String, String> cookiesBeforeNavigation() {
            return cookiesBeforeNavigation;
        }

        public int closeCount() {
            return closeCount.get();
        }

        public int renderCount() {
            return renderCount.get();
        }

    }

}
