package com.e2eq.restcore.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Maps the {@code restcore.*} properties. Everything has a default except the Mongo database
 * name, which is checked when the first connection is made.
 */
@StaticInitSafe
@ConfigMapping(prefix="restcore")
public interface RestCoreConfig {

    Web web();

    Mongo mongo();

    Cors cors();

    Security security();

    LocaleSettings locale();

    Logging logging();

    Listing listing();

    interface Web {
        @WithDefault("Rest API Server")
        String name();

        @WithDefault("8080")
        int port();

        @WithDefault("0.0.0.0")
        String host();
    }

    interface Mongo {
        @WithDefault("mongodb://localhost:27017")
        String uri();

        /**
         * Database name
         * @return the database name, if configured
         */
        Optional<String> database();

        /**
         * Application name reported to the server
         */
        Optional<String> appName();
    }

    interface Cors {
        @WithDefault("X-Lang,Content-Type,Authorization,X-Filename,x-requested-with")
        List<String> allowedHeaders();

        @WithDefault("*")
        String allowedOrigin();
    }

    interface Security {
        /**
         * Session timeout in seconds
         */
        @WithDefault("900")
        int sessionTimeout();

        @WithDefault("false")
        boolean singleSession();

        @WithDefault("XxXxXxXxXxXxX")
        String passwordSalt();

        @WithDefault("false")
        boolean useHttps();
    }

    interface LocaleSettings {
        /**
         * Translation domain
         */
        Optional<String> domain();

        @WithDefault("locale")
        String path();

        @WithDefault("en_EN")
        String defaultLocale();

        @WithDefault("POL")
        String defaultCountry();

        @WithDefault("yyyy-MM-dd'T'HH:mm:ss")
        String defaultTimeFormat();

        @WithDefault("GMT")
        String defaultTimezone();
    }

    interface Logging {
        /**
         * Whether handled REST errors are logged
         */
        @WithDefault("true")
        boolean exceptionsEnabled();

        /**
         * HTTP statuses that are logged besides 500
         */
        @WithDefault("500,501,502,503")
        List<Integer> exceptionsCodes();
    }

    interface Listing {
        @WithDefault("50")
        int perPage();

        @WithDefault("100")
        int maxPerPage();
    }
}
