package com.fcube.app.plugins.deployvps;

/**
 * Shell scripts written by the deploy_vps plugin.
 */
final class DeployVpsScripts {

    private DeployVpsScripts() {
    }

    static String common() {
        return """
                #!/usr/bin/env bash
                set -euo pipefail

                SCRIPT_DIR="$(cd "$(dirname "${BASH_SOURCE[0]}")/.." && pwd)"
                DEPLOY_DIR="$(dirname "$SCRIPT_DIR")"
                CONFIG_FILE="$DEPLOY_DIR/config.env"
                GENERATED_DIR="$DEPLOY_DIR/generated"

                info()  { echo "[INFO] $*"; }
                warn()  { echo "[WARN] $*" >&2; }
                fatal() { echo "[ERROR] $*" >&2; exit 1; }

                load_config() {
                    [[ -f "$CONFIG_FILE" ]] || fatal "config.env not found; copy config.env.example first"
                    set -a
                    source "$CONFIG_FILE"
                    set +a
                }

                parse_env_flag() {
                    ENVIRONMENT="production"
                    while [[ $# -gt 0 ]]; do
                        case "$1" in
                            --env) ENVIRONMENT="$2"; shift 2 ;;
                            *) shift ;;
                        esac
                    done
                    [[ "$ENVIRONMENT" == "production" || "$ENVIRONMENT" == "staging" ]] \\
                        || fatal "unknown environment: $ENVIRONMENT"
                }
                """;
    }

    static String templateEngine() {
        return """
                #!/usr/bin/env bash
                # Replaces {{NAME}} placeholders with values from the environment.

                render_template() {
                    local src="$1" dest="$2" content
                    content="$(cat "$src")"
                    while [[ "$content" =~ \\{\\{([A-Z_]+)\\}\\} ]]; do
                        local name="${BASH_REMATCH[1]}"
                        [[ -n "${!name:-}" ]] || fatal "missing value for $name in config.env"
                        content="${content//\\{\\{$name\\}\\}/${!name}}"
                    done
                    mkdir -p "$(dirname "$dest")"
                    printf '%s\\n' "$content" > "$dest"
                }
                """;
    }

    static String validation() {
        return """
                #!/usr/bin/env bash

                require_vars() {
                    local missing=0
                    for name in "$@"; do
                        if [[ -z "${!name:-}" ]]; then
                            warn "$name is not set"
                            missing=1
                        fi
                    done
                    return $missing
                }

                require_command() {
                    command -v "$1" >/dev/null 2>&1 || fatal "$1 is required but not installed"
                }
                """;
    }

    static String setup() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/common/common.sh"
                source "$SCRIPT_DIR/common/template-engine.sh"

                load_config
                export POSTGRES_PASSWORD="${POSTGRES_PASSWORD:-$(openssl rand -hex 16)}"
                export REDIS_PASSWORD="${REDIS_PASSWORD:-$(openssl rand -hex 16)}"
                export FLOWER_PASSWORD="${FLOWER_PASSWORD:-$(openssl rand -hex 12)}"
                export SECRET_KEY="${SECRET_KEY:-$(openssl rand -hex 32)}"

                for env in production staging; do
                    out="$GENERATED_DIR/$env"
                    render_template "$DEPLOY_DIR/templates/env/$env.env.template" "$out/.env.$env"
                    render_template "$DEPLOY_DIR/templates/docker/$env.compose.yml.template" "$out/compose.yml"
                    render_template "$DEPLOY_DIR/templates/redis/redis.conf.template" "$out/redis.conf"
                    render_template "$DEPLOY_DIR/templates/redis/redis-password.conf.template" "$out/redis-password.conf"
                    for conf in nginx api flower; do
                        render_template "$DEPLOY_DIR/templates/nginx/$conf.conf.template" "$out/nginx/$conf.conf"
                    done
                    info "Rendered $out"
                done
                """;
    }

    static String validate() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/common/common.sh"
                source "$SCRIPT_DIR/common/validation.sh"

                parse_env_flag "$@"
                load_config
                require_command docker
                require_vars PROJECT_NAME DOMAIN ADMIN_EMAIL APP_PORT POSTGRES_DB POSTGRES_USER
                [[ -f "$GENERATED_DIR/$ENVIRONMENT/compose.yml" ]] || fatal "run scripts/setup.sh first"
                docker compose -f "$GENERATED_DIR/$ENVIRONMENT/compose.yml" config -q
                info "Configuration for $ENVIRONMENT is valid"
                """;
    }

    static String deploy() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/common/common.sh"

                ACTION="${1:-up}"
                shift || true
                parse_env_flag "$@"
                COMPOSE=(docker compose -f "$GENERATED_DIR/$ENVIRONMENT/compose.yml")

                case "$ACTION" in
                    init)    "${COMPOSE[@]}" build && "${COMPOSE[@]}" up -d ;;
                    up)      "${COMPOSE[@]}" up -d ;;
                    down)    "${COMPOSE[@]}" down ;;
                    restart) "${COMPOSE[@]}" restart ;;
                    logs)    "${COMPOSE[@]}" logs -f --tail=100 ;;
                    *) fatal "usage: deploy.sh init|up|down|restart|logs [--env production|staging]" ;;
                esac
                """;
    }

    static String ssl() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/common/common.sh"

                ACTION="${1:-setup}"
                shift || true
                parse_env_flag "$@"
                load_config
                domain="$DOMAIN"
                [[ "$ENVIRONMENT" == "staging" ]] && domain="$STAGING_DOMAIN"

                case "$ACTION" in
                    setup)  sudo certbot certonly --webroot -w /var/www/certbot -d "$domain" -d "flower.$domain" \\
                                --email "$ADMIN_EMAIL" --agree-tos --non-interactive ;;
                    renew)  sudo certbot renew --quiet ;;
                    *) fatal "usage: ssl.sh setup|renew [--env production|staging]" ;;
                esac
                """;
    }

    static String backup() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/../common/common.sh"

                load_config
                BACKUP_DIR="$DEPLOY_DIR/backups"
                mkdir -p "$BACKUP_DIR"
                file="$BACKUP_DIR/${POSTGRES_DB}-$(date +%Y%m%d-%H%M%S).sql.gz"
                pg_dump -h "$POSTGRES_HOST" -p "$POSTGRES_PORT" -U "$POSTGRES_USER" "$POSTGRES_DB" | gzip > "$file"
                find "$BACKUP_DIR" -name '*.sql.gz' -mtime +14 -delete
                info "Backup written to $file"
                """;
    }

    static String securitySetup() {
        return """
                #!/usr/bin/env bash
                source "$(dirname "$0")/../common/common.sh"

                sudo ufw default deny incoming
                sudo ufw default allow outgoing
                sudo ufw allow OpenSSH
                sudo ufw allow 80/tcp
                sudo ufw allow 443/tcp
                sudo ufw --force enable
                sudo apt-get install -y fail2ban unattended-upgrades
                info "Firewall and fail2ban configured"
                """;
    }
}
