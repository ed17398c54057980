package org.luxbulb.webinfo;

/**
 * The configuration keys, descriptions and default values for the enricher.
 */
@SuppressWarnings("ALL")
public class EnricherConfig {
    /* --- Dispatcher --- */
    public static final String MAX_CONCURRENCY_CONFIG = "webinfo.max.concurrency";
    public static final String MAX_CONCURRENCY_DOC =
            "The maximum number of origin records to be enriched in parallel.";
    public static final String MAX_CONCURRENCY_DEFAULT = "5";

    public static final String PIPELINE_TIMEOUT_MS_CONFIG = "webinfo.pipeline.timeout";
    public static final String PIPELINE_TIMEOUT_MS_DOC =
            "The time limit for enriching a single record (milliseconds).";
    public static final String PIPELINE_TIMEOUT_MS_DEFAULT = "120000";

    /* --- DNS --- */
    public static final String DNS_SERVERS_CONFIG = "webinfo.dns.servers";
    public static final String DNS_SERVERS_DOC =
            "Comma-separated IP addresses of the DNS resolvers to use. Unparseable entries are ignored.";
    public static final String DNS_SERVERS_DEFAULT = "1.1.1.1";

    public static final String DNS_TIMEOUT_PER_NS_MS_CONFIG = "webinfo.dns.timeout.per.ns";
    public static final String DNS_TIMEOUT_PER_NS_MS_DOC =
            "The timeout for a single query sent to one of the resolvers (milliseconds).";
    public static final String DNS_TIMEOUT_PER_NS_MS_DEFAULT = "5000";

    public static final String DNS_RETRIES_CONFIG = "webinfo.dns.retries";
    public static final String DNS_RETRIES_DOC = "The number of query retries for each resolver.";
    public static final String DNS_RETRIES_DEFAULT = "2";

    /* --- ASN table --- */
    public static final String ASN_DB_PATH_CONFIG = "webinfo.asn.db.path";
    public static final String ASN_DB_PATH_DOC =
            "The path of the ip2asn TSV table (plain or gzip). Defaults to a file in the system temp directory.";
    public static final String ASN_DB_PATH_DEFAULT = "";

    public static final String ASN_DB_URL_CONFIG = "webinfo.asn.db.url";
    public static final String ASN_DB_URL_DOC = "The URL to download the ip2asn table from when it is not present.";
    public static final String ASN_DB_URL_DEFAULT = "https://iptoasn.com/data/ip2asn-combined.tsv.gz";

    public static final String ASN_DB_DOWNLOAD_CONFIG = "webinfo.asn.db.download";
    public static final String ASN_DB_DOWNLOAD_DOC = "If true, a missing ip2asn table is downloaded and cached.";
    public static final String ASN_DB_DOWNLOAD_DEFAULT = "true";

    public static final String ASN_DB_FILE_NAME = "ip2asn-combined.tsv.gz";

    /* --- TLS probe --- */
    public static final String TLS_CONNECT_TIMEOUT_MS_CONFIG = "webinfo.tls.connect.timeout";
    public static final String TLS_CONNECT_TIMEOUT_MS_DOC = "The TCP connect timeout of the TLS probe (milliseconds).";
    public static final String TLS_CONNECT_TIMEOUT_MS_DEFAULT = "1000";

    public static final String TLS_READ_TIMEOUT_MS_CONFIG = "webinfo.tls.read.timeout";
    public static final String TLS_READ_TIMEOUT_MS_DOC =
            "The socket read timeout of the TLS probe, covering the handshake (milliseconds).";
    public static final String TLS_READ_TIMEOUT_MS_DEFAULT = "30000";

    public static final String TLS_PORT_CONFIG = "webinfo.tls.port";
    public static final String TLS_PORT_DOC = "The port the TLS probe connects to.";
    public static final String TLS_PORT_DEFAULT = "443";

    public static final String TLS_TRUST_ALL_CONFIG = "webinfo.tls.trust.all";
    public static final String TLS_TRUST_ALL_DOC =
            "If true, the TLS probe completes handshakes with untrusted (e.g. self-signed) certificate chains.";
    public static final String TLS_TRUST_ALL_DEFAULT = "false";

    public static final String TLS_PROBE_ALWAYS_CONFIG = "webinfo.tls.probe.always";
    public static final String TLS_PROBE_ALWAYS_DOC =
            "If true, the TLS probe also runs for origins that do not use the https scheme.";
    public static final String TLS_PROBE_ALWAYS_DEFAULT = "false";

    /* --- Output --- */
    public static final String OUTPUT_ERRORS_CONFIG = "webinfo.output.errors";
    public static final String OUTPUT_ERRORS_DOC = "If true, failed records are also written to the output.";
    public static final String OUTPUT_ERRORS_DEFAULT = "true";

    public static final String OUTPUT_PRETTY_CONFIG = "webinfo.output.pretty";
    public static final String OUTPUT_PRETTY_DOC = "If true, the output JSON objects are pretty-printed.";
    public static final String OUTPUT_PRETTY_DEFAULT = "false";
}
