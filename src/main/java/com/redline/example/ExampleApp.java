package com.redline.example;

import com.redline.chain.Interceptor;
import com.redline.core.Redline;
import com.redline.core.ServerConfig;
import com.redline.error.RequestException;
import com.redline.http.BodyType;
import com.redline.inject.SimpleServiceLocator;
import com.redline.param.ParameterSpec;
import com.redline.plugin.CommonInterceptors;
import com.redline.plugin.cors.CorsPlugin;
import com.redline.plugin.exception.GlobalExceptionHandlerPlugin;
import com.redline.plugin.jwt.JwtMarker;
import com.redline.plugin.jwt.JwtPlugin;
import com.redline.plugin.monitor.MonitorPlugin;
import io.jsonwebtoken.Claims;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Example application: a small user API with CORS, JWT-protected admin routes, monitoring and
 * JSON error pages.
 *
 * <p>Run with {@code -Dredline.port=9000} to change the port.</p>
 */
public class ExampleApp {

    public static void main(String[] args) {
        Redline app = new Redline(ServerConfig.fromSystemProperties());

        UserStore store = new UserStore();
        app.serviceLocator(new SimpleServiceLocator().bind(UserStore.class, store));

        JwtPlugin jwt = new JwtPlugin("change-me-change-me-change-me-32b",
            new JwtPlugin.JwtConfig().setProtectPattern("/admin/.*"));
        app.register(new CorsPlugin())
            .register(new MonitorPlugin())
            .register(new GlobalExceptionHandlerPlugin())
            .register(jwt);

        app.use(CommonInterceptors.requestLogger("/.*").group(-10))
            .use(CommonInterceptors.securityHeaders("/.*"));

        app.get("/", a -> Map.of("name", "redline", "status", "ok"));

        app.get("/users", a -> a.<UserStore>get("store").all())
            .params(ParameterSpec.service(UserStore.class).named("store"));

        app.get("/users/:id(\\d+)", a -> {
            User user = a.<UserStore>get("store").find(a.<Integer>get("id"));
            if (user == null) {
                throw new RequestException(404, "No user " + a.get("id"));
            }
            return user;
        }).params(ParameterSpec.path("id", int.class), ParameterSpec.service(UserStore.class).named("store"));

        app.post("/users", a -> a.<UserStore>get("store").add(a.get("user")))
            .accepts(BodyType.JSON)
            .params(ParameterSpec.body(User.class).named("user"),
                ParameterSpec.service(UserStore.class).named("store"));

        app.post("/login", a -> Map.of("token", jwt.generateToken(a.get("username"), Map.of("role", "admin"))))
            .accepts(BodyType.JSON, BodyType.FORM)
            .params(ParameterSpec.field("username", String.class));

        app.get("/admin/me", a -> Map.of("subject", a.<Claims>get("claims").getSubject()))
            .params(ParameterSpec.of(JwtMarker.CLAIMS, "claims", Claims.class, null));

        app.get("/slow", a -> Redline.async(() -> {
            Thread.sleep(200);
            return Map.of("path", Redline.request().getPath());
        }));

        app.get("/old", a -> {
            Redline.redirect("/");
            return null;
        });

        app.use(new Interceptor("/users.*", a -> {
            a.request().setAttribute("audited", true);
            a.chain().next();
            return null;
        }).name("audit"));

        app.listen();
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop));
    }

    /** In-memory user store, bound in the service locator. */
    public static class UserStore {
        private final Map<Integer, User> users = new ConcurrentHashMap<>();
        private final AtomicInteger ids = new AtomicInteger();

        public List<User> all() {
            return new ArrayList<>(users.values());
        }

        public User find(int id) {
            return users.get(id);
        }

        public User add(User user) {
            user.setId(ids.incrementAndGet());
            users.put(user.getId(), user);
            return user;
        }
    }

    /**
     * Example user class.
     */
    public static class User {
        private Integer id;
        private String name;
        private String email;

        public User() {
        }

        public User(String name, String email) {
            this.name = name;
            this.email = email;
        }

        public Integer getId() {
            return id;
        }

        public void setId(Integer id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }
    }
}
