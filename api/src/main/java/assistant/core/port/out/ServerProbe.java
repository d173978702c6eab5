package assistant.core.port.out;

/**
 * Port for checking whether an HTTP endpoint answers.
 */
public interface ServerProbe {

    /**
     * Issue a single GET request.
     *
     * <p>This call blocks and never throws; failures yield false.
     *
     * @param url URL to probe
     * @return true when the endpoint answered with status 200
     */
    boolean respondsOk(String url);
}
