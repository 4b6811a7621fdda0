package fun.fengwk.c2md.core.service.convert.model;

/**
 * Kind of a referenced local file.
 *
 * @author fengwk
 */
public enum AssetKind {

    IMAGE,
    ATTACHMENT

}
