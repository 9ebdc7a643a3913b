package velab;

/**
 * Exception raised while declaring or elaborating modules
 */
public class ElaborationException extends VelabException {

	private static final long serialVersionUID = 3391286611025097301L;
	private static final String prefix = "Elaboration Error";

	public ElaborationException(String msg) {
		super(prefix, msg);
	}

}
