package com.fcube.app.plugins.deployvps;

/**
 * Configuration files and documents written by the deploy_vps plugin.
 * Placeholders use {@code {{NAME}}} and are filled by {@code template-engine.sh}.
 */
final class DeployVpsTemplates {

    private DeployVpsTemplates() {
    }

    static String gitignore() {
        return """
                config.env
                generated/*
                !generated/.gitkeep
                backups/
                *.log
                """;
    }

    static String configEnvExample() {
        return """
                # Single source of truth for every generated deployment file.
                PROJECT_NAME=myproject
                DOMAIN=example.com
                STAGING_DOMAIN=staging.example.com
                ADMIN_EMAIL=admin@example.com

                APP_PORT=8000
                WORKERS=4

                POSTGRES_HOST=localhost
                POSTGRES_PORT=5432
                POSTGRES_DB=myproject
                POSTGRES_USER=myproject

                REDIS_MAXMEMORY=256mb
                FLOWER_USER=admin
                """;
    }

    static String readme() {
        return """
                # VPS deployment

                Docker Compose deployment with Nginx, Let's Encrypt SSL, Redis, Celery and Flower.

                ## Layout

                - `config.env.example`: copy to `config.env` and fill in your values
                - `templates/`: env, docker, nginx and redis templates
                - `generated/`: files rendered from the templates by `scripts/setup.sh`
                - `scripts/`: setup, validation, deployment and SSL helpers

                See `QUICK_START.md` for the step-by-step guide.
                """;
    }

    static String quickStart() {
        return """
                # Quick start

                1. `cp config.env.example config.env` and edit it
                2. `./scripts/setup.sh` renders `generated/`
                3. `./scripts/validate.sh --env production`
                4. `./scripts/deploy.sh init --env production`
                5. `./scripts/ssl.sh setup --env production`

                Use `--env staging` for the staging stack.
                """;
    }

    static String envTemplate(String environment) {
        return """
                ENVIRONMENT=%s
                PROJECT_NAME={{PROJECT_NAME}}
                DATABASE_URL=postgresql+asyncpg://{{POSTGRES_USER}}:{{POSTGRES_PASSWORD}}@{{POSTGRES_HOST}}:{{POSTGRES_PORT}}/{{POSTGRES_DB}}
                REDIS_URL=redis://:{{REDIS_PASSWORD}}@redis:6379/0
                CELERY_BROKER_URL=redis://:{{REDIS_PASSWORD}}@redis:6379/1
                SECRET_KEY={{SECRET_KEY}}
                """.formatted(environment);
    }

    static String composeTemplate(String environment) {
        return """
                name: {{PROJECT_NAME}}-%1$s

                services:
                  api:
                    build: ../..
                    env_file: .env.%1$s
                    command: gunicorn app.main:app -k uvicorn.workers.UvicornWorker -w {{WORKERS}} -b 0.0.0.0:{{APP_PORT}}
                    depends_on: [redis]
                    restart: unless-stopped

                  worker:
                    build: ../..
                    env_file: .env.%1$s
                    command: celery -A app.core.celery_app worker --loglevel=info
                    depends_on: [redis]
                    restart: unless-stopped

                  flower:
                    build: ../..
                    env_file: .env.%1$s
                    command: celery -A app.core.celery_app flower --basic_auth={{FLOWER_USER}}:{{FLOWER_PASSWORD}}
                    depends_on: [redis]

                  redis:
                    image: redis:7-alpine
                    command: redis-server /usr/local/etc/redis/redis.conf
                    volumes:
                      - ./redis.conf:/usr/local/etc/redis/redis.conf:ro

                  nginx:
                    image: nginx:1.27-alpine
                    ports: ["80:80", "443:443"]
                    volumes:
                      - ./nginx:/etc/nginx/conf.d:ro
                      - /etc/letsencrypt:/etc/letsencrypt:ro
                    depends_on: [api, flower]
                """.formatted(environment);
    }

    static String nginxConf() {
        return """
                server {
                    listen 80;
                    server_name {{DOMAIN}};

                    location /.well-known/acme-challenge/ {
                        root /var/www/certbot;
                    }

                    location / {
                        return 301 https://$host$request_uri;
                    }
                }
                """;
    }

    static String apiConf() {
        return """
                upstream api {
                    server api:{{APP_PORT}};
                }

                server {
                    listen 443 ssl;
                    server_name {{DOMAIN}};

                    ssl_certificate /etc/letsencrypt/live/{{DOMAIN}}/fullchain.pem;
                    ssl_certificate_key /etc/letsencrypt/live/{{DOMAIN}}/privkey.pem;

                    location / {
                        proxy_pass http://api;
                        proxy_set_header Host $host;
                        proxy_set_header X-Forwarded-For $proxy_add_x_forwarded_for;
                        proxy_set_header X-Forwarded-Proto $scheme;
                    }
                }
                """;
    }

    static String flowerConf() {
        return """
                server {
                    listen 443 ssl;
                    server_name flower.{{DOMAIN}};

                    ssl_certificate /etc/letsencrypt/live/{{DOMAIN}}/fullchain.pem;
                    ssl_certificate_key /etc/letsencrypt/live/{{DOMAIN}}/privkey.pem;

                    location / {
                        proxy_pass http://flower:5555;
                        proxy_set_header Host $host;
                    }
                }
                """;
    }

    static String redisConf() {
        return """
                bind 0.0.0.0
                protected-mode yes
                maxmemory {{REDIS_MAXMEMORY}}
                maxmemory-policy allkeys-lru
                appendonly yes
                include /usr/local/etc/redis/redis-password.conf
                """;
    }

    static String redisPasswordConf() {
        return """
                requirepass {{REDIS_PASSWORD}}
                """;
    }
}
