package fun.fengwk.c2md.core.service.convert;

import fun.fengwk.c2md.core.service.convert.model.ConvertRequest;
import fun.fengwk.c2md.core.service.convert.model.ConvertResponse;

/**
 * Page convert service entry.
 *
 * @author fengwk
 */
public interface PageConvertService {

    ConvertResponse convert(ConvertRequest request);

}
