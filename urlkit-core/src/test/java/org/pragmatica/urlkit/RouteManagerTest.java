package org.pragmatica.urlkit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.urlkit.param.UrlParam;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteManagerTest {
    private RouteManager manager;

    @BeforeEach
    void setUp() {
        manager = RouteManager.routeManager()
                              .registerGroup("api", "https://api.example.com", Map.of("user", "/users/:id", "status", "/status"))
                              .registerGroup("frontend", "https://example.com", Map.of("home", "/"));
        manager.group("frontend")
               .registerGroup("en", "/en", Map.of("about", "/about-us"));
    }

    @Nested
    class Lookup {
        @Test
        void group_rootAndDottedPath_resolve() throws UrlKitException {
            assertThat(manager.group("api")
                              .builder("user")
                              .withParam("id", "123")
                              .build()).isEqualTo("https://api.example.com/users/123");
            assertThat(manager.group("frontend.en")
                              .builder("about")
                              .build()).contains("/en/about-us");
        }

        @Test
        void getGroup_unknownPaths_failWithGroupNotFound() {
            for (var path : List.of("missing", "frontend.missing", "frontend..en", "")) {
                assertThatThrownBy(() -> manager.getGroup(path))
                    .isInstanceOfSatisfying(UrlKitException.class,
                                            e -> assertThat(e.error()).isInstanceOf(RoutingError.GroupNotFound.class));
            }
        }

        @Test
        void group_unknownPath_throwsUnchecked() {
            assertThatThrownBy(() -> manager.group("missing")).isInstanceOf(IllegalStateException.class)
                                                               .hasMessageContaining("missing");
        }

        @Test
        void registerGroup_existingRoot_mergesRoutesAndKeepsBaseUrl() {
            manager.registerGroup("api", "https://other.example.com", Map.of("health", "/health"));

            var api = manager.group("api");
            assertThat(api.baseUrl()).isEqualTo("https://api.example.com");
            assertThat(api.routes()).containsOnlyKeys("user", "status", "health");
            assertThat(manager.rootNames()).containsExactly("api", "frontend");
        }

        @Test
        void addRoutes_unknownGroup_fails() {
            assertThatThrownBy(() -> manager.addRoutes("nope", Map.of("a", "/a")))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(e.error()).isEqualTo(new RoutingError.GroupNotFound("nope")));
        }
    }

    @Nested
    class EnsureGroup {
        @Test
        void ensureGroup_createsMissingGroupsAtDefaultPaths() throws UrlKitException {
            var blog = manager.ensureGroup("frontend.en.blog");
            manager.addRoutes("frontend.en.blog", Map.of("article", "/:slug"));

            assertThat(blog.fqn()).isEqualTo("frontend.en.blog");
            assertThat(manager.group("frontend.en.blog")).isSameAs(blog);
            assertThat(blog.builder("article")
                           .withParam("slug", "launch")
                           .build()).isEqualTo("https://example.com/en/blog/launch");
        }

        @Test
        void ensureGroup_customPathSegment_mountsAtCustomPath() throws UrlKitException {
            manager.ensureGroup("frontend.marketing:/mkt.landing");
            manager.addRoutes("frontend.marketing.landing", Map.of("promo", "/:slug"));

            assertThat(manager.group("frontend.marketing")
                              .path()).isEqualTo("/mkt");
            assertThat(manager.group("frontend.marketing.landing")
                              .path()).isEqualTo("/landing");
            assertThat(manager.group("frontend.marketing.landing")
                              .builder("promo")
                              .withParam("slug", "fall-sale")
                              .build()).isEqualTo("https://example.com/mkt/landing/fall-sale");
        }

        @Test
        void ensureGroup_customPathWithoutSlash_getsLeadingSlash() throws UrlKitException {
            assertThat(manager.ensureGroup("frontend.docs:help")
                              .path()).isEqualTo("/help");
        }

        @Test
        void ensureGroup_existingGroup_keepsItsPath() throws UrlKitException {
            var en = manager.ensureGroup("frontend.en:/english");

            assertThat(en.path()).isEqualTo("/en");
        }

        @Test
        void ensureGroup_isIdempotent() throws UrlKitException {
            var first = manager.ensureGroup("frontend.a.b");
            var second = manager.ensureGroup("frontend.a.b");

            assertThat(second).isSameAs(first);
        }

        @Test
        void ensureGroup_missingRoot_fails() {
            assertThatThrownBy(() -> manager.ensureGroup("backend.v1"))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(e.error()).isEqualTo(new RoutingError.GroupNotFound("backend")));
        }

        @Test
        void ensureGroup_malformedSegments_fail() {
            for (var path : List.of("frontend..x", "frontend.:/path")) {
                assertThatThrownBy(() -> manager.ensureGroup(path))
                    .isInstanceOfSatisfying(UrlKitException.class,
                                            e -> assertThat(e.error()).isInstanceOf(RoutingError.InvalidGroupPath.class));
            }
        }
    }

    @Nested
    class Validate {
        @Test
        void validate_everythingPresent_succeeds() throws UrlKitException {
            manager.validate(Map.of("api", List.of("user", "status"), "frontend.en", List.of("about")));
        }

        @Test
        void validate_problems_aggregatedPerGroup() {
            var expected = new LinkedHashMap<String, List<String>>();
            expected.put("api", List.of("user", "orders"));
            expected.put("frontend.en", List.of("about", "missing.route"));
            expected.put("backend", List.of("anything"));

            assertThatThrownBy(() -> manager.validate(expected))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(((RoutingError.ValidationFailed) e.error()).failures())
                                            .containsExactly(Map.entry("api", List.of("orders")),
                                                             Map.entry("backend", List.of("Missing group")),
                                                             Map.entry("frontend.en", List.of("missing.route"))))
                .hasMessageStartingWith("Validation error: group api missing: [orders]");
        }

        @Test
        void validate_nullRouteList_onlyChecksGroupExists() {
            var expected = new LinkedHashMap<String, List<String>>();
            expected.put("api", null);
            expected.put("backend", null);

            assertThatThrownBy(() -> manager.validate(expected))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(((RoutingError.ValidationFailed) e.error()).failures())
                                            .containsExactly(Map.entry("backend", List.of("Missing group"))));
        }

        @Test
        void mustValidate_problems_throwUnchecked() {
            assertThatThrownBy(() -> manager.mustValidate(Map.of("api", List.of("nope"))))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void mustValidate_success_returnsManager() {
            assertThat(manager.mustValidate(Map.of("api", List.of("user")))).isSameAs(manager);
        }
    }

    @Nested
    class Resolution {
        record UserRef(@UrlParam("id") long userId, String ignoredByRoute) {}

        @Test
        void resolve_coercesParamsAndAddsQuery() throws UrlKitException {
            var url = manager.resolve("api", "user", Map.of("id", 123), Map.of("include", "profile"));

            assertThat(url).isEqualTo("https://api.example.com/users/123?include=profile");
        }

        @Test
        void resolve_nullInputs_areEmpty() throws UrlKitException {
            assertThat(manager.resolve("api", "status", null, null)).isEqualTo("https://api.example.com/status");
        }

        @Test
        void resolveWith_recordAndMultiValueQuery() throws UrlKitException {
            var url = manager.resolveWith("api",
                                          "user",
                                          new UserRef(7, "x"),
                                          Map.of("tab", List.of("a", "b")));

            assertThat(url).isEqualTo("https://api.example.com/users/7?tab=a&tab=b");
        }

        @Test
        void resolveWith_unsupportedInputs_fail() {
            assertThatThrownBy(() -> manager.resolveWith("api", "user", 42, null))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(e.error()).isInstanceOf(RoutingError.UnsupportedParams.class));
            assertThatThrownBy(() -> manager.resolveWith("api", "user", Map.of("id", 1), List.of("q")))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(e.error()).isInstanceOf(RoutingError.UnsupportedQuery.class));
        }

        @Test
        void routePath_joinsGroupPathWithRawTemplate() throws UrlKitException {
            manager.ensureGroup("frontend.en.blog")
                   .addRoutes(Map.of("article", "/:slug"));

            assertThat(manager.routePath("frontend.en.blog", "article")).isEqualTo("/en/blog/:slug");
            assertThat(manager.routePath("api", "user")).isEqualTo("/users/:id");
        }

        @Test
        void routePath_unknownRoute_fails() {
            assertThatThrownBy(() -> manager.routePath("api", "missing"))
                .isInstanceOfSatisfying(UrlKitException.class,
                                        e -> assertThat(e.error()).isEqualTo(new RoutingError.RouteNotFound("api", "missing")));
        }

        @Test
        void resolver_canBeUsedThroughNarrowContract() throws UrlKitException {
            Resolver resolver = manager;

            assertThat(resolver.resolve("frontend.en", "about", Map.of(), Map.of())).isEqualTo("https://example.com/en/about-us");
        }
    }

    @Nested
    class DebugTree {
        @Test
        void debugTree_emptyManager_isMarkedEmpty() {
            assertThat(RouteManager.routeManager()
                                   .debugTree()).isEqualTo("RouteManager: <empty>");
        }

        @Test
        void debugTree_listsGroupsAlphabetically() {
            var frontend = manager.group("frontend");
            frontend.setUrlTemplate("{base_url}{route_path}");
            frontend.setTemplateVar("locale", "en");

            var expected = """
                RouteManager Debug Tree:
                - api (base="https://api.example.com")
                  routes:
                    - status: /status
                    - user: /users/:id

                - frontend (base="https://example.com")
                  template: "{base_url}{route_path}"
                  vars:
                    locale = "en"
                  routes:
                    - home: /
                  - frontend.en (path="/en")
                    vars:
                      locale = "en"
                    routes:
                      - about: /about-us
                """;

            assertThat(manager.debugTree()).isEqualTo(expected);
        }
    }
}
